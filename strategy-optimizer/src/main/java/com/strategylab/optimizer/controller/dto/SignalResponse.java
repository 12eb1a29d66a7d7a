package com.strategylab.optimizer.controller.dto;

import com.strategylab.optimizer.domain.Signal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalResponse {

    private String symbol;
    private String strategyName;
    private Instant timestamp;
    private Signal signal;
}
