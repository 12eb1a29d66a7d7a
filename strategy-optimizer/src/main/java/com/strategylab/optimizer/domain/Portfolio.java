package com.strategylab.optimizer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cash, open position, equity curve and trade ledger of one backtest run.
 * Owned by a single run and never shared.
 */
@Slf4j
public class Portfolio {

    private final BigDecimal initialCapital;
    private BigDecimal cash;
    private Position position = Position.flat();
    private final List<Trade> trades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    public Portfolio(BigDecimal initialCapital) {
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
    }

    /**
     * Open a long position. The fee is charged on the notional and taken from cash at once.
     *
     * @return false when cash does not cover notional plus fee, or a position is already open
     */
    public boolean buy(Instant timestamp, BigDecimal price, BigDecimal quantity, BigDecimal feeRate) {
        if (position.isLong() || quantity.signum() <= 0) {
            return false;
        }

        BigDecimal notional = price.multiply(quantity);
        BigDecimal fee = notional.multiply(feeRate);
        BigDecimal cost = notional.add(fee);
        if (cash.compareTo(cost) < 0) {
            log.debug("Insufficient cash {} for {} units at {} (cost incl. fee {})", cash, quantity, price, cost);
            return false;
        }

        cash = cash.subtract(cost);
        position = Position.builder()
                .side(PositionSide.LONG)
                .quantity(quantity)
                .entryPrice(price)
                .entryTimestamp(timestamp)
                .entryFee(fee)
                .build();
        return true;
    }

    /**
     * Close the open position and append the round trip to the ledger.
     *
     * @return the recorded trade, or null when flat
     */
    public Trade sell(Instant timestamp, BigDecimal price, BigDecimal feeRate, ExitReason reason) {
        if (!position.isLong()) {
            return null;
        }

        BigDecimal quantity = position.getQuantity();
        BigDecimal proceeds = price.multiply(quantity);
        BigDecimal exitFee = proceeds.multiply(feeRate);
        BigDecimal grossPnl = price.subtract(position.getEntryPrice()).multiply(quantity);
        BigDecimal feePaid = position.getEntryFee().add(exitFee);

        Trade trade = Trade.builder()
                .entryTimestamp(position.getEntryTimestamp())
                .entryPrice(position.getEntryPrice())
                .exitTimestamp(timestamp)
                .exitPrice(price)
                .quantity(quantity)
                .grossPnl(grossPnl)
                .feePaid(feePaid)
                .netPnl(grossPnl.subtract(feePaid))
                .exitReason(reason)
                .build();

        cash = cash.add(proceeds).subtract(exitFee);
        position = Position.flat();
        trades.add(trade);
        return trade;
    }

    /**
     * Cash plus the open position marked at {@code markPrice}.
     */
    public BigDecimal getEquity(BigDecimal markPrice) {
        if (!position.isLong()) {
            return cash;
        }
        BigDecimal mark = markPrice != null ? markPrice : position.getEntryPrice();
        return cash.add(position.marketValue(mark));
    }

    void recordEquity(Instant timestamp, BigDecimal markPrice) {
        equityCurve.add(new EquityPoint(timestamp, getEquity(markPrice)));
    }

    public boolean isLong() {
        return position.isLong();
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public BigDecimal getCash() {
        return cash;
    }

    public Position getPosition() {
        return position;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }
}
