package com.couplesync.backend.pairing.dto;

public record PairingStats(
        long total,
        long accepted,
        long pending,
        long rejected,
        int maxPairings,
        long availableSlots,
        boolean canCreateMore
) {}
