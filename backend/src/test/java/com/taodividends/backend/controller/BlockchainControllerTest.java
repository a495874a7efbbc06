package com.taodividends.backend.controller;

import com.taodividends.backend.client.ChainClient;
import com.taodividends.backend.client.StakeReceipt;
import com.taodividends.backend.exception.StakeRejectedException;
import com.taodividends.backend.guard.IdempotencyGuard;
import com.taodividends.backend.model.StakeDirection;
import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.service.SentimentService;
import com.taodividends.backend.support.TestCacheConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestCacheConfig.class)
class BlockchainControllerTest {

    private static final String TOKEN = "Bearer test-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IdempotencyGuard idempotencyGuard;

    @MockBean
    private ChainClient chainClient;

    @MockBean
    private SentimentService sentimentService;

    @Test
    void stakeReturnsReceipt() throws Exception {
        when(chainClient.submit(eq(StakeDirection.STAKE), eq(18), eq("HSTAKE1"), eq(new BigDecimal("1.250000000")),
                anyString())).thenReturn(new StakeReceipt("0xbeef"));

        mockMvc.perform(post("/api/v1/blockchain/stake")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1.25,\"netuid\":18,\"hotkey\":\"HSTAKE1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.operation_type").value("stake"))
                .andExpect(jsonPath("$.tx_hash").value("0xbeef"));

        mockMvc.perform(get("/api/v1/blockchain/stake-transaction-history")
                        .param("hotkey", "HSTAKE1")
                        .header("Authorization", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].origin").value("DIRECT"))
                .andExpect(jsonPath("$[0].status").value("CONFIRMED"));
    }

    @Test
    void rejectedUnstakeIsUnprocessable() throws Exception {
        when(chainClient.submit(eq(StakeDirection.UNSTAKE), eq(18), eq("HSTAKE2"), any(), anyString()))
                .thenThrow(new StakeRejectedException("unstake rejected: not enough stake"));

        mockMvc.perform(post("/api/v1/blockchain/unstake")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":3,\"netuid\":18,\"hotkey\":\"HSTAKE2\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("UNPROCESSABLE_ENTITY"));

        mockMvc.perform(get("/api/v1/blockchain/stake-transaction-history")
                        .param("hotkey", "HSTAKE2").param("operation_type", "unstake")
                        .header("Authorization", TOKEN))
                .andExpect(jsonPath("$[0].status").value("FAILED"));
    }

    @Test
    void nonPositiveAmountIsRejectedBeforeChain() throws Exception {
        mockMvc.perform(post("/api/v1/blockchain/stake")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-1,\"hotkey\":\"HSTAKE3\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("amount"));

        mockMvc.perform(post("/api/v1/blockchain/stake")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hotkey\":\"HSTAKE3\"}"))
                .andExpect(status().isBadRequest());

        verify(chainClient, never()).submit(any(), anyInt(), anyString(), any(), anyString());
    }

    @Test
    void accountWithTradeInFlightIsConflict() throws Exception {
        TradeKey key = new TradeKey(18, "HSTAKE4");
        idempotencyGuard.tryAcquire(key, "task-held");
        try {
            mockMvc.perform(post("/api/v1/blockchain/stake")
                            .header("Authorization", TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":1,\"netuid\":18,\"hotkey\":\"HSTAKE4\"}"))
                    .andExpect(status().isConflict());
        } finally {
            idempotencyGuard.release(key, "task-held");
        }
    }

    @Test
    void historyParametersAreValidated() throws Exception {
        mockMvc.perform(get("/api/v1/blockchain/dividend-history").param("limit", "0")
                        .header("Authorization", TOKEN))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/blockchain/stake-transaction-history").param("operation_type", "transfer")
                        .header("Authorization", TOKEN))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/blockchain/dividend-history").param("netuid", "18")
                        .header("Authorization", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
