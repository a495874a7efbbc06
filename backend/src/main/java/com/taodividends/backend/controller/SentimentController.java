package com.taodividends.backend.controller;

import com.taodividends.backend.dto.SentimentAnalysisResponse;
import com.taodividends.backend.service.HistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sentiment")
@RequiredArgsConstructor
@Tag(name = "Sentiment")
public class SentimentController {

    private final HistoryService historyService;

    @GetMapping("/history")
    @Operation(summary = "Sentiment scores obtained by trade tasks, newest first")
    public ResponseEntity<List<SentimentAnalysisResponse>> history(
            @RequestParam(required = false) Integer netuid,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(historyService.listSentimentAnalyses(netuid, limit, offset));
    }
}
