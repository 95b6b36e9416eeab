package com.animequote.interfaces.api.dto;

import com.animequote.domain.subtitle.model.DialogueEntry;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResponse(
        boolean success,
        List<DialogueEntry> entries,
        String error
) {
    public static ParseResponse ok(List<DialogueEntry> entries) {
        return new ParseResponse(true, entries, null);
    }

    public static ParseResponse failure(String error) {
        return new ParseResponse(false, List.of(), error);
    }
}
