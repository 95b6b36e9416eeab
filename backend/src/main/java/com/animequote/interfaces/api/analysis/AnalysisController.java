package com.animequote.interfaces.api.analysis;

import com.animequote.application.subtitle.SubtitleAnalysisAppService;
import com.animequote.domain.analysis.model.SentenceAnalysis;
import com.animequote.infrastructure.analysis.tokenizer.MorphologicalTokenizer;
import com.animequote.interfaces.api.dto.AnalyzeRequest;
import com.animequote.interfaces.api.dto.AnalyzeResponse;
import com.animequote.interfaces.api.dto.HealthResponse;
import com.animequote.interfaces.api.dto.SentenceAnalysisResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private static final String SERVICE_NAME = "anime-quote-analyzer";

    private final SubtitleAnalysisAppService subtitleAnalysisAppService;
    private final MorphologicalTokenizer tokenizer;

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        SentenceAnalysis analysis = subtitleAnalysisAppService.analyzeSentence(request.text());

        log.info("[Analyze] Analysis complete. JLPT Level: {}, Tokens: {}, Vocab: {}",
                analysis.level(), analysis.tokens().size(), analysis.vocabulary().size());

        return ResponseEntity.ok(new AnalyzeResponse(SentenceAnalysisResponse.from(analysis)));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", SERVICE_NAME, tokenizer.name()));
    }
}
