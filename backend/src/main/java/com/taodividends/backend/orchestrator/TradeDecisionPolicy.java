package com.taodividends.backend.orchestrator;

import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.model.StakeDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps a normalised sentiment score to a trade: positive stakes, negative unstakes,
 * amount proportional to the magnitude and capped.
 */
@Component
@RequiredArgsConstructor
public class TradeDecisionPolicy {

    // Amounts are in TAO; the chain works in rao (1e-9 TAO).
    static final int AMOUNT_SCALE = 9;

    private final TaoProperties taoProperties;

    public TradeDecision decide(double score) {
        if (Double.isNaN(score) || score == 0.0) {
            return TradeDecision.none();
        }
        StakeDirection direction = score > 0 ? StakeDirection.STAKE : StakeDirection.UNSTAKE;
        TaoProperties.Trade trade = taoProperties.getTrade();
        BigDecimal magnitude = BigDecimal.valueOf(Math.min(1.0, Math.abs(score)));
        BigDecimal amount = trade.getUnitAmount()
                .multiply(magnitude)
                .min(trade.getMaxAmount())
                .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            return TradeDecision.none();
        }
        return new TradeDecision(direction, amount);
    }
}
