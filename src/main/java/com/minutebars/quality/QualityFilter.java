package com.minutebars.quality;

import com.minutebars.model.RawBar;
import com.minutebars.model.ValidatedBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns provider rows into validated bars.
 *
 * <p>Stages run in a fixed order and each one only narrows the set: timestamp parsing,
 * numeric coercion, required fields, price/volume invariants, first-wins de-duplication by
 * (symbol, timestamp), then an ascending sort by timestamp. Rejected rows are only counted;
 * the filter never throws.
 */
public final class QualityFilter {
    private static final Logger log = LogManager.getLogger(QualityFilter.class);

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private final ZoneId marketZone;

    public QualityFilter(ZoneId marketZone) {
        this.marketZone = marketZone == null ? ZoneId.of("America/New_York") : marketZone;
    }

    public CleanResult clean(List<RawBar> rawBars, String symbol) {
        Map<RejectReason, Integer> removed = new EnumMap<>(RejectReason.class);
        if (rawBars == null || rawBars.isEmpty()) {
            return new CleanResult(List.of(), 0, removed);
        }
        String normalizedSymbol = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (normalizedSymbol.isEmpty()) {
            removed.put(RejectReason.BLANK_SYMBOL, rawBars.size());
            return new CleanResult(List.of(), rawBars.size(), removed);
        }

        List<ValidatedBar> out = new ArrayList<>(rawBars.size());
        Set<Instant> seen = new HashSet<>();
        for (RawBar raw : rawBars) {
            Candidate candidate = new Candidate();
            RejectReason reason = evaluate(raw, candidate);
            if (reason == null && !seen.add(candidate.barTime.toInstant())) {
                reason = RejectReason.DUPLICATE;
            }
            if (reason != null) {
                removed.merge(reason, 1, Integer::sum);
                if (log.isDebugEnabled()) {
                    log.debug("drop {} {}: {}", normalizedSymbol, reason, raw);
                }
                continue;
            }
            out.add(new ValidatedBar(
                    normalizedSymbol,
                    candidate.barTime,
                    candidate.barTime.toLocalDate(),
                    candidate.open,
                    candidate.high,
                    candidate.low,
                    candidate.close,
                    candidate.volume
            ));
        }
        out.sort(Comparator.comparing(bar -> bar.barTime.toInstant()));
        return new CleanResult(out, rawBars.size(), removed);
    }

    private RejectReason evaluate(RawBar raw, Candidate candidate) {
        if (raw == null) {
            return RejectReason.MISSING_FIELD;
        }

        OffsetDateTime barTime = parseTimestamp(raw.date);
        if (barTime == null) {
            return RejectReason.UNPARSABLE_TIMESTAMP;
        }
        candidate.barTime = barTime;

        Double open;
        Double high;
        Double low;
        Double close;
        Long volume;
        try {
            open = parsePrice(raw.open);
            high = parsePrice(raw.high);
            low = parsePrice(raw.low);
            close = parsePrice(raw.close);
            volume = parseVolume(raw.volume);
        } catch (NumberFormatException e) {
            return RejectReason.NON_NUMERIC;
        }
        if (open == null || high == null || low == null || close == null || volume == null) {
            return RejectReason.MISSING_FIELD;
        }

        if (!(close > 0.0)
                || volume < 0L
                || high < low
                || high < close
                || low > close
                || !(open > 0.0)
                || !(low > 0.0)) {
            return RejectReason.INVARIANT_VIOLATION;
        }

        candidate.open = open;
        candidate.high = high;
        candidate.low = low;
        candidate.close = close;
        candidate.volume = volume;
        return null;
    }

    private OffsetDateTime parseTimestamp(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        try {
            LocalDateTime local = LocalDateTime.parse(text.trim(), TIMESTAMP_FORMAT);
            return local.atZone(marketZone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Parses a price; {@code null} when blank.
     *
     * @throws NumberFormatException when present but not a finite decimal number
     */
    private static Double parsePrice(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        double value = new BigDecimal(text.trim()).doubleValue();
        if (!Double.isFinite(value)) {
            throw new NumberFormatException("not finite: " + text);
        }
        return value;
    }

    /**
     * Parses a whole-number volume; {@code null} when blank.
     *
     * @throws NumberFormatException when present but not an integer that fits in a long
     */
    private static Long parseVolume(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text.trim()).longValueExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException("not a whole number: " + text);
        }
    }

    private static final class Candidate {
        private OffsetDateTime barTime;
        private double open;
        private double high;
        private double low;
        private double close;
        private long volume;
    }
}
