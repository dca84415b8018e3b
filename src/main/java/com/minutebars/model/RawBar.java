package com.minutebars.model;

/**
 * One per-minute bar exactly as the provider returned it.
 * Every field may be missing ({@code null}) or malformed.
 */
public final class RawBar {
    public final String symbol;
    public final String date;
    public final String open;
    public final String high;
    public final String low;
    public final String close;
    public final String volume;

    public RawBar(String symbol, String date, String open, String high, String low, String close, String volume) {
        this.symbol = symbol;
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public String toString() {
        return "RawBar{" + symbol + " " + date + " o=" + open + " h=" + high + " l=" + low
                + " c=" + close + " v=" + volume + "}";
    }
}
