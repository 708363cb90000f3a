package com.couplesync.backend.program.repo;

import com.couplesync.backend.program.entity.ProgramStep;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProgramStepRepository extends JpaRepository<ProgramStep, Long> {

    List<ProgramStep> findByProgramIdOrderByDayAsc(Long programId);

    /** crossover 偵測用：同一個 step 的兩個 request 在這裡排隊 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ProgramStep s where s.id = :id")
    Optional<ProgramStep> findByIdForUpdate(@Param("id") Long id);

    long countByProgramIdAndStartedTrue(Long programId);

    long countByProgramId(Long programId);

    @Modifying(flushAutomatically = true)
    @Query("update ProgramStep s set s.started = true, s.startedAt = :now where s.id = :id and s.started = false")
    int markStarted(@Param("id") Long id, @Param("now") Instant now);

    /** compare-and-set：回 1 的那個 request 才能排程生成 */
    @Modifying(flushAutomatically = true)
    @Query("update ProgramStep s set s.responseTriggeredAt = :now where s.id = :id and s.responseTriggeredAt is null")
    int markResponseTriggered(@Param("id") Long id, @Param("now") Instant now);

    @Query("""
            select s.conversationStarter from ProgramStep s
             where s.programId = :programId
               and exists (select 1 from StepMessage m
                            where m.stepId = s.id
                              and m.messageType = com.couplesync.backend.message.entity.MessageType.USER_MESSAGE)
             order by s.day asc
            """)
    List<String> findStartersWithUserMessages(@Param("programId") Long programId);
}
