package com.couplesync.backend.message.service;

import com.couplesync.backend.message.entity.MessageType;
import com.couplesync.backend.message.entity.StepMessage;
import com.couplesync.backend.message.repo.StepMessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成結果寫成系統訊息：照模型回傳順序，sequence 1..total 連續
 * 每則各自 commit，中途失敗時前面寫好的保留
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StepMessageWriter {

    public static final String GENERATED_RESPONSE = "generated_response";

    private final StepMessageRepository repo;
    private final ObjectMapper om;
    private final Clock clock;

    /** @return 實際寫入幾則 */
    public int appendSystemMessages(Long stepId, List<String> texts) {
        int total = texts.size();
        int written = 0;
        for (int i = 0; i < total; i++) {
            appendOne(stepId, texts.get(i), i + 1, total);
            written++;
        }
        log.info("step_system_messages_written stepId={} total={}", stepId, written);
        return written;
    }

    /** repo.save 自帶 transaction */
    public StepMessage appendOne(Long stepId, String text, int sequence, int total) {
        StepMessage m = new StepMessage();
        m.setStepId(stepId);
        m.setSenderId(null);
        m.setMessageType(MessageType.SYSTEM);
        m.setContent(text);
        m.setMetadata(metadata(sequence, total));
        m.setCreatedAt(clock.instant());
        return repo.save(m);
    }

    String metadata(int sequence, int total) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("type", GENERATED_RESPONSE);
        meta.put("sequence", sequence);
        meta.put("total", total);
        try {
            return om.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("METADATA_SERIALIZE_FAILED", e);
        }
    }
}
