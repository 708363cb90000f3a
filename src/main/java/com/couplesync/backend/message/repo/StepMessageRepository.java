package com.couplesync.backend.message.repo;

import com.couplesync.backend.message.entity.MessageType;
import com.couplesync.backend.message.entity.StepMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StepMessageRepository extends JpaRepository<StepMessage, Long> {

    List<StepMessage> findByStepIdOrderByIdAsc(Long stepId);

    List<StepMessage> findByStepIdAndSenderIdAndMessageTypeOrderByIdAsc(Long stepId, Long senderId, MessageType type);

    long countByStepIdAndMessageType(Long stepId, MessageType type);
}
