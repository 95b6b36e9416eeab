package com.animequote.interfaces.api.subtitle;

import com.animequote.application.subtitle.SubtitleAnalysisAppService;
import com.animequote.domain.subtitle.model.DialogueEntry;
import com.animequote.domain.subtitle.model.SubtitleAnalysisResult;
import com.animequote.interfaces.api.dto.ParseResponse;
import com.animequote.interfaces.api.dto.SubtitleAnalysisResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/v1/subtitles")
@RequiredArgsConstructor
public class SubtitleController {

    private static final String NO_FILE = "No file provided";

    private final SubtitleAnalysisAppService subtitleAnalysisAppService;

    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ParseResponse> parse(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(ParseResponse.failure(NO_FILE));
        }

        List<DialogueEntry> entries = subtitleAnalysisAppService.parseSubtitles(
                file.getOriginalFilename(), readContent(file));

        return ResponseEntity.ok(ParseResponse.ok(entries));
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(ParseResponse.failure(NO_FILE));
        }

        SubtitleAnalysisResult result = subtitleAnalysisAppService.analyzeSubtitles(
                file.getOriginalFilename(), readContent(file));

        return ResponseEntity.ok(SubtitleAnalysisResponse.from(result));
    }

    private String readContent(MultipartFile file) {
        try {
            return new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded subtitle file", e);
        }
    }
}
