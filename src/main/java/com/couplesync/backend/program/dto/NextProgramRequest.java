package com.couplesync.backend.program.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record NextProgramRequest(
        @NotBlank @Size(max = 2000) String userInput
) {}
