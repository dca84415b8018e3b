package com.minutebars.model;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A bar that passed the quality filter: positive finite prices, non-negative volume,
 * {@code low <= close <= high}.
 */
public final class ValidatedBar {
    public final String symbol;
    public final OffsetDateTime barTime;
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final long volume;

    public ValidatedBar(
            String symbol,
            OffsetDateTime barTime,
            LocalDate tradeDate,
            double open,
            double high,
            double low,
            double close,
            long volume
    ) {
        this.symbol = symbol;
        this.barTime = barTime;
        this.tradeDate = tradeDate;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public String toString() {
        return "ValidatedBar{" + symbol + " " + barTime + " o=" + open + " h=" + high + " l=" + low
                + " c=" + close + " v=" + volume + "}";
    }
}
