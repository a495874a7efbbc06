package com.taodividends.backend.controller;

import com.taodividends.backend.dto.TradeTaskResponse;
import com.taodividends.backend.service.TradeTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/trade-tasks")
@RequiredArgsConstructor
@Tag(name = "Trade Tasks")
public class TradeTaskController {

    private final TradeTaskService tradeTaskService;

    @GetMapping("/{taskId}")
    @Operation(summary = "State and outcome of a background trade")
    public ResponseEntity<TradeTaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(tradeTaskService.getTask(taskId));
    }
}
