package com.taodividends.backend.controller;

import com.taodividends.backend.model.DividendQuery;
import com.taodividends.backend.service.DividendQueryDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tao_dividends")
@RequiredArgsConstructor
@Tag(name = "Tao Dividends")
public class TaoDividendsController {

    private final DividendQueryDispatcher dividendQueryDispatcher;

    @GetMapping
    @Operation(summary = "Get Tao dividends",
            description = "Dividend for a netuid and hotkey, served from a 2 minute cache. Omitting hotkey while "
                    + "giving netuid returns every known hotkey of that subnet. With trade=true a sentiment "
                    + "driven stake or unstake is started in the background.")
    public ResponseEntity<?> getDividends(
            @Parameter(description = "Subnet id") @RequestParam(required = false) Integer netuid,
            @Parameter(description = "Account public key") @RequestParam(required = false) String hotkey,
            @Parameter(description = "Trigger sentiment analysis and stake/unstake")
            @RequestParam(defaultValue = "false") boolean trade) {
        if (hotkey == null && netuid != null) {
            return ResponseEntity.ok(dividendQueryDispatcher.handleBatch(netuid, trade));
        }
        DividendQuery query = dividendQueryDispatcher.resolve(netuid, hotkey);
        return ResponseEntity.ok(dividendQueryDispatcher.handle(query, trade));
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Drop the cached dividend for a netuid and hotkey")
    public ResponseEntity<Void> evict(@RequestParam(required = false) Integer netuid,
                                      @RequestParam(required = false) String hotkey) {
        dividendQueryDispatcher.evict(dividendQueryDispatcher.resolve(netuid, hotkey));
        return ResponseEntity.noContent().build();
    }
}
