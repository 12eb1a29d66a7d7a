package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The single open position of a run, or {@link #flat()}.
 */
@Value
@Builder
public class Position {

    private static final Position FLAT = Position.builder()
            .side(PositionSide.FLAT)
            .quantity(BigDecimal.ZERO)
            .build();

    PositionSide side;
    BigDecimal quantity;
    BigDecimal entryPrice;
    Instant entryTimestamp;
    BigDecimal entryFee;

    public static Position flat() {
        return FLAT;
    }

    public boolean isLong() {
        return side == PositionSide.LONG;
    }

    public BigDecimal marketValue(BigDecimal price) {
        return isLong() ? quantity.multiply(price) : BigDecimal.ZERO;
    }
}
