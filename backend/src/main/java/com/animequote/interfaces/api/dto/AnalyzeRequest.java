package com.animequote.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @NotBlank(message = "Text is required")
        @Size(max = 1000, message = "Text must not exceed 1000 characters")
        String text
) {}
