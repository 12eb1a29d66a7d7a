package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * A closed round trip. Created when a position goes from LONG to FLAT.
 */
@Value
@Builder
public class Trade {

    Instant entryTimestamp;
    BigDecimal entryPrice;
    Instant exitTimestamp;
    BigDecimal exitPrice;
    BigDecimal quantity;
    BigDecimal grossPnl;
    BigDecimal feePaid;
    BigDecimal netPnl;
    ExitReason exitReason;

    /**
     * True for the mark-to-market close applied when the data runs out while still long.
     */
    public boolean isForcedExit() {
        return exitReason == ExitReason.END_OF_DATA;
    }

    /**
     * Net P&L relative to the entry notional, in percent.
     */
    public BigDecimal getReturnPct() {
        BigDecimal notional = entryPrice.multiply(quantity);
        if (notional.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return netPnl.multiply(BigDecimal.valueOf(100))
                .divide(notional, 4, RoundingMode.HALF_UP);
    }

    public boolean isWin() {
        return netPnl.signum() > 0;
    }

    public boolean isLoss() {
        return netPnl.signum() < 0;
    }
}
