package com.animequote.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeResponse(
        boolean success,
        SentenceAnalysisResponse analysis,
        String error
) {
    public AnalyzeResponse(SentenceAnalysisResponse analysis) {
        this(true, analysis, null);
    }
}
