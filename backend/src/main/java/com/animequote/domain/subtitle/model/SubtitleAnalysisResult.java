package com.animequote.domain.subtitle.model;

import com.animequote.domain.analysis.model.SentenceAnalysis;

import java.util.List;

/**
 * Parsed subtitle file plus the analyses of its leading entries.
 *
 * @param entries  every retained dialogue entry, in file order
 * @param analyses analyses of the first entries, same order as {@code entries}
 */
public record SubtitleAnalysisResult(
        List<DialogueEntry> entries,
        List<SentenceAnalysis> analyses
) {
    public SubtitleAnalysisResult {
        entries = List.copyOf(entries);
        analyses = List.copyOf(analyses);
    }
}
