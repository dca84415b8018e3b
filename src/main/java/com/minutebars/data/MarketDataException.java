package com.minutebars.data;

/**
 * A provider request that produced no usable payload.
 */
public class MarketDataException extends Exception {
    public static final String TIMEOUT = "timeout";
    public static final String IO = "io";
    public static final String RATE_LIMIT = "rate_limit";
    public static final String HTTP = "http";
    public static final String PAYLOAD = "payload";
    public static final String INTERRUPTED = "interrupted";

    private final String category;

    public MarketDataException(String message, String category) {
        super(message);
        this.category = category == null ? "other" : category;
    }

    public MarketDataException(String message, String category, Throwable cause) {
        super(message, cause);
        this.category = category == null ? "other" : category;
    }

    public String category() {
        return category;
    }
}
