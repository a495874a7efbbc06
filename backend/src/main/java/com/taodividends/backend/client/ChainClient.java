package com.taodividends.backend.client;

import com.taodividends.backend.model.StakeDirection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Chain gateway that reads subnet state and signs stake operations with the custodied wallet.
 * <p>
 * Transient failures surface as {@link com.taodividends.backend.exception.UpstreamUnavailableException},
 * refused operations as {@link com.taodividends.backend.exception.StakeRejectedException}.
 */
public interface ChainClient {

    BigInteger fetchDividend(int netuid, String hotkey);

    List<String> listHotkeys(int netuid);

    /**
     * @param idempotencyKey stable per logical operation so a retried call is not executed twice
     */
    StakeReceipt submit(StakeDirection direction, int netuid, String hotkey, BigDecimal amount, String idempotencyKey);
}
