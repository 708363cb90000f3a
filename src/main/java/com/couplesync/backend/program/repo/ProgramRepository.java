package com.couplesync.backend.program.repo;

import com.couplesync.backend.program.entity.PlanStatus;
import com.couplesync.backend.program.entity.Program;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProgramRepository extends JpaRepository<Program, Long> {

    @Query("select p from Program p where p.id = :id and p.deletedAt is null")
    Optional<Program> findActiveById(@Param("id") Long id);

    /** 自己的 + 透過 accepted pairing 共享的 */
    @Query("""
            select p from Program p
             where p.deletedAt is null
               and (p.userId = :userId
                    or p.pairingId in (
                        select pr.id from Pairing pr
                         where pr.status = com.couplesync.backend.pairing.entity.PairingStatus.ACCEPTED
                           and pr.deletedAt is null
                           and (pr.requesterId = :userId or pr.partnerId = :userId)))
             order by p.createdAt desc
            """)
    List<Program> findAccessible(@Param("userId") Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Program p set p.deletedAt = :now where p.id = :id and p.userId = :ownerId and p.deletedAt is null")
    int softDeleteByOwner(@Param("id") Long id, @Param("ownerId") Long ownerId, @Param("now") Instant now);

    /** 解鎖只做一次 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Program p set p.nextProgramUnlocked = true where p.id = :id and p.nextProgramUnlocked = false")
    int markUnlocked(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Program p
               set p.planStatus = :status, p.generationError = :error
             where p.id = :id and p.planStatus = com.couplesync.backend.program.entity.PlanStatus.GENERATING
            """)
    int finishGeneration(@Param("id") Long id, @Param("status") PlanStatus status, @Param("error") String error);

    /** 手動重跑：只有 FAILED 能回到 GENERATING，錯誤碼一起清掉 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Program p
               set p.planStatus = com.couplesync.backend.program.entity.PlanStatus.GENERATING, p.generationError = null
             where p.id = :id
               and p.deletedAt is null
               and p.planStatus = com.couplesync.backend.program.entity.PlanStatus.FAILED
            """)
    int restartGeneration(@Param("id") Long id);
}
