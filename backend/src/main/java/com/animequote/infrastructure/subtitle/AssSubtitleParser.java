package com.animequote.infrastructure.subtitle;

import com.animequote.domain.subtitle.model.DialogueEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Advanced SubStation Alpha (.ass/.ssa) parser. Only {@code Dialogue:} event lines are read:
 *
 * <pre>
 * Dialogue: 0,0:00:01.00,0:00:04.00,Default,,0,0,0,,{\i1}こんにちは{\i0}
 * </pre>
 *
 * The first nine comma-separated fields are metadata (layer, start, end, style, actor,
 * three margins, effect); everything after them is the dialogue, which may itself contain commas.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssSubtitleParser {

    private static final String DIALOGUE_PREFIX = "Dialogue:";
    private static final int METADATA_FIELDS = 9;
    private static final int START_FIELD = 1;
    private static final int END_FIELD = 2;

    private static final Pattern OVERRIDE_BLOCK = Pattern.compile("\\{[^}]*}");

    private final SubtitleTextCleaner textCleaner;

    public List<DialogueEntry> parse(String content) {
        List<DialogueEntry> entries = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return entries;
        }

        int nextId = 1;
        int skipped = 0;

        for (String line : content.split("\n")) {
            if (!line.startsWith(DIALOGUE_PREFIX)) {
                continue;
            }

            String[] fields = line.split(",", -1);
            if (fields.length <= METADATA_FIELDS) {
                skipped++;
                continue;
            }

            String payload = String.join(",", Arrays.copyOfRange(fields, METADATA_FIELDS, fields.length));
            String rawText = OVERRIDE_BLOCK.matcher(payload).replaceAll("").strip();

            Optional<String> text = textCleaner.cleanDialogue(rawText);
            if (text.isEmpty()) {
                log.debug("[AssParser] Skipping non-Japanese entry: '{}'", rawText);
                skipped++;
                continue;
            }

            entries.add(new DialogueEntry(
                    nextId++,
                    fields[START_FIELD].strip(),
                    fields[END_FIELD].strip(),
                    text.get()));
        }

        log.debug("[AssParser] {} entries kept, {} dialogue lines skipped", entries.size(), skipped);
        return entries;
    }
}
