package com.animequote.application.subtitle;

import com.animequote.application.subtitle.exception.InvalidSentenceException;
import com.animequote.application.subtitle.exception.UnsupportedFormatException;
import com.animequote.domain.analysis.model.SentenceAnalysis;
import com.animequote.domain.subtitle.model.DialogueEntry;
import com.animequote.domain.subtitle.model.SubtitleAnalysisResult;
import com.animequote.domain.subtitle.model.SubtitleFormat;
import com.animequote.infrastructure.analysis.SentenceAnnotator;
import com.animequote.infrastructure.analysis.tokenizer.MorphologicalTokenizer;
import com.animequote.infrastructure.subtitle.SubtitleParser;
import com.animequote.infrastructure.subtitle.SubtitleTextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubtitleAnalysisAppService {

    public static final int DEFAULT_BATCH_MAX_ENTRIES = 5;

    private final SubtitleParser subtitleParser;
    private final SubtitleTextCleaner textCleaner;
    private final MorphologicalTokenizer tokenizer;
    private final SentenceAnnotator sentenceAnnotator;

    @Value("${analysis.batch.max-entries:" + DEFAULT_BATCH_MAX_ENTRIES + "}")
    private int batchMaxEntries = DEFAULT_BATCH_MAX_ENTRIES;

    /**
     * Parse an uploaded subtitle file. The format comes from the file extension.
     *
     * @throws UnsupportedFormatException for anything but .srt, .ass and .ssa
     */
    public List<DialogueEntry> parseSubtitles(String fileName, String content) {
        SubtitleFormat format = SubtitleFormat.fromFileName(fileName)
                .orElseThrow(() -> new UnsupportedFormatException(fileName));

        log.info("[SubtitleService] Parsing {} ({} chars)", fileName, content == null ? 0 : content.length());
        return subtitleParser.parse(content, format);
    }

    /**
     * Analyze a single sentence typed or selected by the user.
     *
     * @throws InvalidSentenceException when the text is blank or has no Japanese characters
     */
    public SentenceAnalysis analyzeSentence(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            throw new InvalidSentenceException("Text cannot be empty");
        }
        if (!textCleaner.hasJapaneseContent(trimmed)) {
            throw new InvalidSentenceException("Text must contain Japanese characters");
        }
        return annotate(trimmed);
    }

    /**
     * Parse a subtitle file and analyze its first entries concurrently. Analyses come back in
     * entry order regardless of completion order.
     */
    public SubtitleAnalysisResult analyzeSubtitles(String fileName, String content) {
        List<DialogueEntry> entries = parseSubtitles(fileName, content);
        List<DialogueEntry> batch = entries.subList(0, Math.min(Math.max(batchMaxEntries, 0), entries.size()));

        long start = System.currentTimeMillis();

        List<CompletableFuture<SentenceAnalysis>> futures = batch.stream()
                .map(entry -> CompletableFuture.supplyAsync(() -> annotate(entry.text())))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SentenceAnalysis> analyses = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        log.info("[SubtitleService] Analyzed {}/{} entries of {} in {}ms",
                analyses.size(), entries.size(), fileName, System.currentTimeMillis() - start);
        return new SubtitleAnalysisResult(entries, analyses);
    }

    private SentenceAnalysis annotate(String text) {
        return sentenceAnnotator.annotate(text, tokenizer.tokenize(text));
    }
}
