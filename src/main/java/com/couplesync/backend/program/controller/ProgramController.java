package com.couplesync.backend.program.controller;

import com.couplesync.backend.auth.security.AuthContext;
import com.couplesync.backend.generation.config.OpenAiProperties;
import com.couplesync.backend.generation.model.GenerationMetrics;
import com.couplesync.backend.generation.service.GenerationTelemetry;
import com.couplesync.backend.program.dto.CreateProgramRequest;
import com.couplesync.backend.program.dto.NextProgramRequest;
import com.couplesync.backend.program.dto.ProgramDto;
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
@RequestMapping("/api/programs")
public class ProgramController {

    private final ProgramService programService;
    private final GenerationTelemetry telemetry;
    private final OpenAiProperties openAiProps;
    private final AuthContext auth;

    /** 202：計畫在背景生成，planStatus=GENERATING */
    @PostMapping
    public ResponseEntity<ProgramDto> create(@Valid @RequestBody CreateProgramRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(programService.create(auth.requireUserId(), req));
    }

    @PostMapping("/{id}/next_program")
    public ResponseEntity<ProgramDto> next(@PathVariable Long id, @Valid @RequestBody NextProgramRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(programService.createNext(auth.requireUserId(), id, req));
    }

    /** 202：只有 FAILED 且沒有 step 的 program 能重跑 */
    @PostMapping("/{id}/therapy_response")
    public ResponseEntity<ProgramDto> regenerate(@PathVariable Long id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(programService.regeneratePlan(auth.requireUserId(), id));
    }

    @GetMapping("/metrics")
    public GenerationMetrics metrics() {
        return telemetry.snapshot(openAiProps.isEnabled());
    }

    @GetMapping
    public List<ProgramDto> list() {
        return programService.list(auth.requireUserId());
    }

    @GetMapping("/{id}")
    public ProgramDto get(@PathVariable Long id) {
        return programService.get(auth.requireUserId(), id);
    }

    @GetMapping("/{id}/steps")
    public List<ProgramStepDto> steps(@PathVariable Long id) {
        return programService.steps(auth.requireUserId(), id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        programService.delete(auth.requireUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
