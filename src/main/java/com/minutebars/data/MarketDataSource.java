package com.minutebars.data;

import com.minutebars.model.RawBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Provider of raw per-minute bars.
 */
public interface MarketDataSource {

    /**
     * Fetches every bar for {@code symbol} between the two dates, both inclusive.
     *
     * @return the provider's bars, empty when the provider has no data in range
     * @throws MarketDataException on network errors, non-2xx responses or malformed payloads
     */
    List<RawBar> fetch(String symbol, LocalDate fromDate, LocalDate toDate) throws MarketDataException;
}
