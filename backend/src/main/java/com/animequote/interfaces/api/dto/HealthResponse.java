package com.animequote.interfaces.api.dto;

public record HealthResponse(
        String status,
        String service,
        String tokenizer
) {}
