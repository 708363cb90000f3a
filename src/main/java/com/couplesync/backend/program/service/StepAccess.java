package com.couplesync.backend.program.service;

import com.couplesync.backend.pairing.entity.Pairing;
import com.couplesync.backend.program.entity.Program;
import com.couplesync.backend.program.entity.ProgramStep;

import java.util.Optional;

/**
 * 存取檢查通過後的 step + 所屬 program
 * pairing 只有在 accepted 且未刪除時才不是 null
 */
public record StepAccess(
        ProgramStep step,
        Program program,
        Pairing pairing
) {
    public Optional<Pairing> acceptedPairing() {
        return Optional.ofNullable(pairing);
    }
}
