package com.couplesync.backend.pairing.repo;

import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.pairing.entity.PairingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PairingRepository extends JpaRepository<Pairing, Long> {

    @Query("select p from Pairing p where p.id = :id and p.deletedAt is null")
    Optional<Pairing> findActiveById(@Param("id") Long id);

    /** restore 用：含已刪除 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Pairing p where p.id = :id")
    Optional<Pairing> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select count(p) from Pairing p
             where (p.requesterId = :userId or p.partnerId = :userId)
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.ACCEPTED
               and p.deletedAt is null
            """)
    long countAccepted(@Param("userId") Long userId);

    /** 還有沒被用掉的 pending 邀請碼 */
    @Query("""
            select count(p) from Pairing p
             where p.requesterId = :userId
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.PENDING
               and p.partnerCode is not null
               and p.deletedAt is null
            """)
    long countOpenRequests(@Param("userId") Long userId);

    boolean existsByPartnerCode(String partnerCode);

    /** 同一個 code 的 accept 在這裡排隊；輸家等到鎖時 row 已不是 pending，拿到 empty */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from Pairing p
             where p.partnerCode = :code
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.PENDING
               and p.partnerId is null
               and p.deletedAt is null
            """)
    Optional<Pairing> findPendingByCodeForUpdate(@Param("code") String code);

    @Query("""
            select count(p) from Pairing p
             where ((p.requesterId = :a and p.partnerId = :b) or (p.requesterId = :b and p.partnerId = :a))
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.ACCEPTED
               and p.deletedAt is null
            """)
    long countAcceptedBetween(@Param("a") Long a, @Param("b") Long b);

    /**
     * ✅ accept 的唯一寫入點：條件式 update
     * 同一個 code 兩個人同時 accept，只會有一個拿到 1
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Pairing p
               set p.partnerId = :partnerId,
                   p.partnerCode = null,
                   p.status = com.couplesync.backend.pairing.entity.PairingStatus.ACCEPTED,
                   p.acceptedAt = :now
             where p.partnerCode = :code
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.PENDING
               and p.partnerId is null
               and p.deletedAt is null
               and p.requesterId <> :partnerId
            """)
    int acceptByCode(@Param("code") String code, @Param("partnerId") Long partnerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Pairing p
               set p.status = com.couplesync.backend.pairing.entity.PairingStatus.REJECTED,
                   p.partnerCode = null
             where p.id = :id
               and p.status = com.couplesync.backend.pairing.entity.PairingStatus.PENDING
               and p.deletedAt is null
            """)
    int reject(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Pairing p set p.deletedAt = :now where p.id = :id and p.deletedAt is null")
    int softDelete(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Pairing p set p.deletedAt = null where p.id = :id and p.deletedAt is not null")
    int restore(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Pairing p set p.deletedAt = :now
             where (p.requesterId = :userId or p.partnerId = :userId)
               and p.deletedAt is null
            """)
    int softDeleteAllForUser(@Param("userId") Long userId, @Param("now") Instant now);

    @Query("""
            select p from Pairing p
             where (p.requesterId = :userId or p.partnerId = :userId)
               and p.deletedAt is null
             order by p.createdAt desc
            """)
    List<Pairing> findAllForUser(@Param("userId") Long userId);

    @Query("""
            select p from Pairing p
             where (p.requesterId = :userId or p.partnerId = :userId)
             order by p.createdAt desc
            """)
    List<Pairing> findAllForUserIncludingDeleted(@Param("userId") Long userId);

    @Query("""
            select p from Pairing p
             where (p.requesterId = :userId or p.partnerId = :userId)
               and p.status = :status
               and p.deletedAt is null
             order by p.createdAt desc
            """)
    List<Pairing> findForUserByStatus(@Param("userId") Long userId, @Param("status") PairingStatus status);
}
