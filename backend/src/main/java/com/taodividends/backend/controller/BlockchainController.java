package com.taodividends.backend.controller;

import com.taodividends.backend.dto.DividendRecordResponse;
import com.taodividends.backend.dto.StakeOperationResponse;
import com.taodividends.backend.dto.StakeRequest;
import com.taodividends.backend.dto.StakeTransactionResponse;
import com.taodividends.backend.service.HistoryService;
import com.taodividends.backend.service.StakingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/blockchain")
@RequiredArgsConstructor
@Tag(name = "Blockchain Operations")
public class BlockchainController {

    private final StakingService stakingService;
    private final HistoryService historyService;

    @PostMapping("/stake")
    @Operation(summary = "Stake TAO to a hotkey", description = "Omitted netuid or hotkey fall back to the defaults.")
    public ResponseEntity<StakeOperationResponse> stake(@Valid @RequestBody StakeRequest request) {
        return ResponseEntity.ok(stakingService.stake(request));
    }

    @PostMapping("/unstake")
    @Operation(summary = "Unstake TAO from a hotkey", description = "Omitted netuid or hotkey fall back to the defaults.")
    public ResponseEntity<StakeOperationResponse> unstake(@Valid @RequestBody StakeRequest request) {
        return ResponseEntity.ok(stakingService.unstake(request));
    }

    @GetMapping("/dividend-history")
    @Operation(summary = "Dividend history, newest first")
    public ResponseEntity<List<DividendRecordResponse>> dividendHistory(
            @RequestParam(required = false) Integer netuid,
            @RequestParam(required = false) String hotkey,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(historyService.listDividends(netuid, hotkey, limit, offset));
    }

    @GetMapping("/stake-transaction-history")
    @Operation(summary = "Stake and unstake transactions, newest first")
    public ResponseEntity<List<StakeTransactionResponse>> stakeTransactionHistory(
            @RequestParam(required = false) Integer netuid,
            @RequestParam(required = false) String hotkey,
            @RequestParam(name = "operation_type", required = false) String operationType,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(historyService.listTransactions(netuid, hotkey, operationType, limit, offset));
    }
}
