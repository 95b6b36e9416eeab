package com.animequote.infrastructure.subtitle;

import com.animequote.domain.subtitle.model.DialogueEntry;
import com.animequote.domain.subtitle.model.SubtitleFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Best-effort subtitle parsing: malformed blocks and entries without Japanese dialogue
 * are dropped, the rest of the file is still returned. Never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubtitleParser {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final SrtSubtitleParser srtParser;
    private final AssSubtitleParser assParser;

    public List<DialogueEntry> parse(String rawContent, SubtitleFormat format) {
        if (rawContent == null || rawContent.isBlank() || format == null) {
            return List.of();
        }

        String content = normalizeLineEndings(stripByteOrderMark(rawContent));

        List<DialogueEntry> entries = switch (format) {
            case SRT -> srtParser.parse(content);
            case ASS -> assParser.parse(content);
        };

        log.info("[SubtitleParser] Parsed {} dialogue entries from {} chars ({})",
                entries.size(), rawContent.length(), format);
        return List.copyOf(entries);
    }

    private String stripByteOrderMark(String content) {
        return content.charAt(0) == BYTE_ORDER_MARK ? content.substring(1) : content;
    }

    private String normalizeLineEndings(String content) {
        return content.replace("\r\n", "\n").replace("\r", "\n");
    }
}
