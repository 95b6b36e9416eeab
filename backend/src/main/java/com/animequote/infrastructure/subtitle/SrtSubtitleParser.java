package com.animequote.infrastructure.subtitle;

import com.animequote.domain.subtitle.model.DialogueEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SubRip (.srt) parser.
 *
 * <pre>
 * 1
 * 00:00:01,000 --> 00:00:04,000
 * （教師）よ〜し
 * </pre>
 *
 * Blocks are separated by blank lines. A block needs an id line, a timecode line and at
 * least one text line; anything else is skipped without failing the file. The id line is
 * not validated: when it holds no readable number the block's 1-based position is used.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SrtSubtitleParser {

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");

    private static final Pattern TIMECODE_PAIR = Pattern.compile(
            "(\\d{2}:\\d{2}:\\d{2},\\d{3})\\s*-->\\s*(\\d{2}:\\d{2}:\\d{2},\\d{3})");

    // ASCII digits at the start of the id line, as in "12" or "12 "
    private static final Pattern LEADING_ID = Pattern.compile("^\\s*([0-9]+)");

    private static final int MIN_BLOCK_LINES = 3;

    private final SubtitleTextCleaner textCleaner;

    public List<DialogueEntry> parse(String content) {
        List<DialogueEntry> entries = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return entries;
        }

        String[] blocks = BLOCK_SEPARATOR.split(content.strip());
        int skipped = 0;

        for (int i = 0; i < blocks.length; i++) {
            Optional<DialogueEntry> entry = parseBlock(blocks[i], i + 1);
            if (entry.isPresent()) {
                entries.add(entry.get());
            } else {
                skipped++;
            }
        }

        log.debug("[SrtParser] {} entries kept, {} blocks skipped", entries.size(), skipped);
        return entries;
    }

    private Optional<DialogueEntry> parseBlock(String block, int position) {
        String[] lines = block.split("\n");
        if (lines.length < MIN_BLOCK_LINES) {
            return Optional.empty();
        }

        Matcher timecode = TIMECODE_PAIR.matcher(lines[1]);
        if (!timecode.find()) {
            return Optional.empty();
        }

        String rawText = String.join("\n", Arrays.copyOfRange(lines, 2, lines.length)).strip();
        Optional<String> text = textCleaner.cleanDialogue(rawText);
        if (text.isEmpty()) {
            log.debug("[SrtParser] Skipping non-Japanese entry: '{}'", rawText);
            return Optional.empty();
        }

        int id = parseId(lines[0], position);
        return Optional.of(new DialogueEntry(id, timecode.group(1), timecode.group(2), text.get()));
    }

    private int parseId(String line, int position) {
        Matcher matcher = LEADING_ID.matcher(line);
        if (matcher.find()) {
            try {
                return Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                log.debug("[SrtParser] Id '{}' out of range, using position {}", matcher.group(1), position);
                return position;
            }
        }
        log.debug("[SrtParser] Unreadable id line '{}', using position {}", line, position);
        return position;
    }
}
