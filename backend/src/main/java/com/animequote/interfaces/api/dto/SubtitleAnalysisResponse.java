package com.animequote.interfaces.api.dto;

import com.animequote.domain.subtitle.model.DialogueEntry;
import com.animequote.domain.subtitle.model.SubtitleAnalysisResult;

import java.util.List;

public record SubtitleAnalysisResponse(
        boolean success,
        List<DialogueEntry> entries,
        List<SentenceAnalysisResponse> analyses
) {
    public static SubtitleAnalysisResponse from(SubtitleAnalysisResult result) {
        return new SubtitleAnalysisResponse(
                true,
                result.entries(),
                result.analyses().stream().map(SentenceAnalysisResponse::from).toList());
    }
}
