package com.couplesync.backend.pairing.controller;

import com.couplesync.backend.auth.security.AuthContext;
import com.couplesync.backend.pairing.dto.AcceptPairingRequest;
import com.couplesync.backend.pairing.dto.PairingCodeDto;
import com.couplesync.backend.pairing.dto.PairingDto;
import com.couplesync.backend.pairing.dto.PairingStats;
import com.couplesync.backend.pairing.entity.PairingStatus;
import com.couplesync.backend.pairing.service.PairingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/pairings")
public class PairingController {

    private final PairingService pairingService;
    private final AuthContext auth;

    @PostMapping("/request")
    public ResponseEntity<PairingCodeDto> request() {
        return ResponseEntity.status(HttpStatus.CREATED).body(pairingService.requestPairing(auth.requireUserId()));
    }

    @PostMapping("/accept")
    public PairingDto accept(@Valid @RequestBody AcceptPairingRequest req) {
        return pairingService.acceptByCode(auth.requireUserId(), req.partnerCode());
    }

    @PostMapping("/{id}/reject")
    public PairingDto reject(@PathVariable Long id) {
        return pairingService.reject(auth.requireUserId(), id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        pairingService.softDelete(auth.requireUserId(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/restore")
    public PairingDto restore(@PathVariable Long id) {
        return pairingService.restore(auth.requireUserId(), id);
    }

    @GetMapping
    public List<PairingDto> list(@RequestParam(defaultValue = "false") boolean includeDeleted) {
        return pairingService.listForUser(auth.requireUserId(), includeDeleted);
    }

    @GetMapping("/pending")
    public List<PairingDto> pending() {
        return pairingService.listByStatus(auth.requireUserId(), PairingStatus.PENDING);
    }

    @GetMapping("/accepted")
    public List<PairingDto> accepted() {
        return pairingService.listByStatus(auth.requireUserId(), PairingStatus.ACCEPTED);
    }

    @GetMapping("/stats")
    public PairingStats stats() {
        return pairingService.stats(auth.requireUserId());
    }

    @GetMapping("/{id}")
    public PairingDto get(@PathVariable Long id, @RequestParam(defaultValue = "false") boolean includeDeleted) {
        Long uid = auth.requireUserId();
        return includeDeleted ? pairingService.getIncludingDeleted(uid, id) : pairingService.get(uid, id);
    }
}
