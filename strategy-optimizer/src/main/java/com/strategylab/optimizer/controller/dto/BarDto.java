package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.Bar;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OHLCV bar supplied inline. A missing close is accepted and treated as a data gap.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarDto {

    @NotNull(message = "Bar timestamp is required")
    private Instant timestamp;

    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;

    public Bar toBar() {
        return Bar.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
