package com.couplesync.backend.pairing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AcceptPairingRequest(@NotBlank @Size(max = 16) String partnerCode) {}
