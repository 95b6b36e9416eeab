package com.animequote.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
