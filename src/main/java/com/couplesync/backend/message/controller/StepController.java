package com.couplesync.backend.message.controller;

import com.couplesync.backend.auth.security.AuthContext;
import com.couplesync.backend.message.dto.PostMessageRequest;
import com.couplesync.backend.message.dto.PostMessageResult;
import com.couplesync.backend.message.dto.StepMessageDto;
import com.couplesync.backend.message.service.StepMessageService;
import com.couplesync.backend.program.dto.ProgramStepDto;
import com.couplesync.backend.program.service.ProgramService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/steps")
public class StepController {

    private final StepMessageService messageService;
    private final ProgramService programService;
    private final AuthContext auth;

    @GetMapping("/{stepId}")
    public ProgramStepDto get(@PathVariable Long stepId) {
        return programService.step(auth.requireUserId(), stepId);
    }

    @GetMapping("/{stepId}/messages")
    public List<StepMessageDto> messages(@PathVariable Long stepId) {
        return messageService.list(auth.requireUserId(), stepId);
    }

    @PostMapping("/{stepId}/messages")
    public ResponseEntity<PostMessageResult> post(@PathVariable Long stepId, @Valid @RequestBody PostMessageRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(messageService.post(auth.requireUserId(), stepId, req.content()));
    }

    @PutMapping("/{stepId}/messages/{messageId}")
    public StepMessageDto edit(@PathVariable Long stepId,
                               @PathVariable Long messageId,
                               @Valid @RequestBody PostMessageRequest req) {
        return messageService.edit(auth.requireUserId(), stepId, messageId, req.content());
    }
}
