package com.couplesync.backend.auth.repo;

import com.couplesync.backend.auth.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface RefreshTokenRepo extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    long countByUserId(Long userId);

    @Modifying
    @Query("delete from RefreshToken r where r.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Transactional
    @Modifying
    @Query("delete from RefreshToken r where r.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * ✅ 旋轉用 compare-and-set：只有舊 hash 仍存在且未過期才會成功
     * 兩個 request 同時拿同一顆 refresh token，只會有一個回 1
     */
    @Modifying
    @Query("""
            update RefreshToken r
               set r.tokenHash = :newHash, r.expiresAt = :expiresAt
             where r.tokenHash = :oldHash and r.expiresAt > :now
            """)
    int rotate(@Param("oldHash") String oldHash,
               @Param("newHash") String newHash,
               @Param("expiresAt") Instant expiresAt,
               @Param("now") Instant now);

    /** 滑動過期：把仍有效的 session 往後推 */
    @Transactional
    @Modifying
    @Query("update RefreshToken r set r.expiresAt = :expiresAt where r.userId = :userId and r.expiresAt > :now")
    int extendForUser(@Param("userId") Long userId,
                      @Param("expiresAt") Instant expiresAt,
                      @Param("now") Instant now);
}
