package com.animequote.domain.subtitle.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum SubtitleFormat {
    SRT(List.of(".srt")),
    ASS(List.of(".ass", ".ssa"));

    private final List<String> extensions;

    SubtitleFormat(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Resolve the format from a file name by its extension, ignoring case.
     */
    public static Optional<SubtitleFormat> fromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        String lower = fileName.strip().toLowerCase(Locale.ROOT);
        for (SubtitleFormat format : values()) {
            for (String extension : format.extensions) {
                if (lower.endsWith(extension)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }
}
