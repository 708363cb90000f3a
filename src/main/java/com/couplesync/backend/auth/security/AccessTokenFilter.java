package com.couplesync.backend.auth.security;

import com.couplesync.backend.auth.service.TokenService;
import com.couplesync.backend.auth.token.TokenClaims;
import com.couplesync.backend.auth.token.TokenVerificationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    private final TokenService tokenService;

    public AccessTokenFilter(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        // 放行登入與健康檢查
        return p.startsWith("/auth") || p.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            chain.doFilter(req, res); // 交給 EntryPoint 回 401
            return;
        }

        TokenClaims claims;
        try {
            claims = tokenService.verifyAccess(auth.substring(7).trim());
        } catch (TokenVerificationException e) {
            // 過期 vs 簽章/格式錯：client 依 code 決定要不要走 refresh
            if (e.isExpired()) unauthorized(res, "TOKEN_EXPIRED", "Token expired", "The access token expired");
            else unauthorized(res, "TOKEN_INVALID", "Invalid token", "The access token is invalid");
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                new AuthContext.AuthPrincipal(claims.sub(), claims.email()),
                null,
                Collections.emptyList()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        // 滑動 session（背景執行，不等）
        tokenService.extendOnActivity(claims.sub());

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res, String code, String message, String description)
            throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        // RFC 6750 challenge
        res.setHeader(HttpHeaders.WWW_AUTHENTICATE,
                "Bearer realm=\"api\", error=\"invalid_token\", error_description=\"" + description + "\"");
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"" + code + "\",\"message\":\"" + message + "\"}");
    }
}
