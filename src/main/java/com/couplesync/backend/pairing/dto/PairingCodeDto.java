package com.couplesync.backend.pairing.dto;

public record PairingCodeDto(Long pairingId, String partnerCode) {}
