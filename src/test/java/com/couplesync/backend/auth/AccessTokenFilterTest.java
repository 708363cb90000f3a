package com.couplesync.backend.auth;

import com.couplesync.backend.auth.security.AccessTokenFilter;
import com.couplesync.backend.auth.security.AuthContext;
import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.auth.token.TokenClaims;
import com.couplesync.backend.auth.token.TokenVerificationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class AccessTokenFilterTest {

    private TokenService tokenService;
    private AccessTokenFilter filter;

    @BeforeEach
    void setUp() {
        tokenService = mock(TokenService.class);
        filter = new AccessTokenFilter(tokenService);
    }

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest get(String uri, String bearer) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", uri);
        if (bearer != null) req.addHeader("Authorization", "Bearer " + bearer);
        return req;
    }

    @Test
    void valid_token_authenticates_and_extends_session() throws Exception {
        when(tokenService.verifyAccess("good")).thenReturn(
                new TokenClaims(7L, "a@x.com", TokenClaims.TYPE_ACCESS, "couplesync", 0L, 0L, "j1"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(get("/api/programs", "good"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(((AuthContext.AuthPrincipal) auth.getPrincipal()).userId()).isEqualTo(7L);
        verify(tokenService).extendOnActivity(7L);
    }

    @Test
    void expired_token_gets_distinct_code_and_bearer_challenge() throws Exception {
        when(tokenService.verifyAccess("old")).thenThrow(new TokenVerificationException(TokenVerificationException.Failure.EXPIRED));
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(get("/api/programs", "old"), res, chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("\"code\":\"TOKEN_EXPIRED\"");
        assertThat(res.getHeader("WWW-Authenticate")).startsWith("Bearer").contains("invalid_token").contains("expired");
        assertThat(chain.getRequest()).isNull();
        verify(tokenService, never()).extendOnActivity(anyLong());
    }

    @Test
    void forged_token_is_invalid_not_expired() throws Exception {
        when(tokenService.verifyAccess("forged")).thenThrow(new TokenVerificationException(TokenVerificationException.Failure.INVALID_SIGNATURE));
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(get("/api/programs", "forged"), res, new MockFilterChain());

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("\"code\":\"TOKEN_INVALID\"");
        assertThat(res.getHeader("WWW-Authenticate")).contains("invalid");
    }

    @Test
    void auth_endpoints_and_missing_header_pass_through() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(get("/auth/login", "whatever"), new MockHttpServletResponse(), chain);
        assertThat(chain.getRequest()).isNotNull();

        MockFilterChain chain2 = new MockFilterChain();
        filter.doFilter(get("/api/programs", null), new MockHttpServletResponse(), chain2);
        assertThat(chain2.getRequest()).isNotNull();

        verifyNoInteractions(tokenService);
    }
}
