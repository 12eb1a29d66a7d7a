package com.strategylab.optimizer.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class EquityPoint {
    Instant timestamp;
    BigDecimal equity;
}
