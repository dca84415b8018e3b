package com.minutebars.quality;

import com.minutebars.model.ValidatedBar;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Validated bars of one cleaning pass plus how many inputs were rejected and why.
 */
public final class CleanResult {
    public final List<ValidatedBar> bars;
    public final int inputCount;
    private final Map<RejectReason, Integer> removedByReason;

    CleanResult(List<ValidatedBar> bars, int inputCount, Map<RejectReason, Integer> removedByReason) {
        this.bars = bars == null ? List.of() : List.copyOf(bars);
        this.inputCount = Math.max(0, inputCount);
        EnumMap<RejectReason, Integer> copy = new EnumMap<>(RejectReason.class);
        if (removedByReason != null) {
            copy.putAll(removedByReason);
        }
        this.removedByReason = Collections.unmodifiableMap(copy);
    }

    public int removed() {
        int total = 0;
        for (int count : removedByReason.values()) {
            total += count;
        }
        return total;
    }

    public int removed(RejectReason reason) {
        return removedByReason.getOrDefault(reason, 0);
    }

    public Map<RejectReason, Integer> removedByReason() {
        return removedByReason;
    }

    public String removedText() {
        if (removedByReason.isEmpty()) {
            return "none";
        }
        StringJoiner joiner = new StringJoiner(",");
        removedByReason.forEach((reason, count) -> joiner.add(reason.name().toLowerCase(Locale.ROOT) + "=" + count));
        return joiner.toString();
    }
}
