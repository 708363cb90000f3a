package com.couplesync.backend.users.user.repo;

import com.couplesync.backend.users.user.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id and u.deletedAt is null")
    Optional<User> findActiveByIdForUpdate(@Param("id") Long id);

    @Query("select u from User u where u.id = :id and u.deletedAt is null")
    Optional<User> findActiveById(@Param("id") Long id);

    @Query("select u from User u where lower(u.email) = lower(:email) and u.deletedAt is null")
    Optional<User> findActiveByEmail(@Param("email") String email);

    boolean existsByEmailIgnoreCase(String email);

    /** 只有尚未刪除才會成功（回 0 代表不存在或已刪） */
    @Transactional
    @Modifying
    @Query("update User u set u.deletedAt = :now where u.id = :id and u.deletedAt is null")
    int softDelete(@Param("id") Long id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("update User u set u.deletedAt = null where u.id = :id and u.deletedAt is not null")
    int restore(@Param("id") Long id);
}
