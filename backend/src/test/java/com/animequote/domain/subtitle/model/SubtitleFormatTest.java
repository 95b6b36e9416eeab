package com.animequote.domain.subtitle.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubtitleFormatTest {

    @Test
    @DisplayName("Extensions are matched ignoring case")
    void known_extensions() {
        assertThat(SubtitleFormat.fromFileName("episode01.srt")).contains(SubtitleFormat.SRT);
        assertThat(SubtitleFormat.fromFileName("EPISODE01.SRT")).contains(SubtitleFormat.SRT);
        assertThat(SubtitleFormat.fromFileName("ep.ass")).contains(SubtitleFormat.ASS);
        assertThat(SubtitleFormat.fromFileName("ep.ssa")).contains(SubtitleFormat.ASS);
    }

    @Test
    @DisplayName("Unknown or missing extensions → empty")
    void unknown_extensions() {
        assertThat(SubtitleFormat.fromFileName("ep.vtt")).isEmpty();
        assertThat(SubtitleFormat.fromFileName("srt")).isEmpty();
        assertThat(SubtitleFormat.fromFileName(null)).isEmpty();
        assertThat(SubtitleFormat.fromFileName(" ")).isEmpty();
    }
}
