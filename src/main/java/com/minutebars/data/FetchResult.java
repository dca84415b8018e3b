package com.minutebars.data;

import com.minutebars.model.RawBar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one fetch step: rows, a legitimately empty range, or a recovered failure.
 */
public final class FetchResult {
    public enum Status {
        OK,
        EMPTY,
        FAILED
    }

    public final Status status;
    public final List<RawBar> bars;
    public final String error;
    public final String errorCategory;

    private FetchResult(Status status, List<RawBar> bars, String error, String errorCategory) {
        this.status = status;
        this.bars = bars == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bars));
        this.error = error == null ? "" : error;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
    }

    public static FetchResult success(List<RawBar> bars) {
        if (bars == null || bars.isEmpty()) {
            return empty();
        }
        return new FetchResult(Status.OK, bars, "", "");
    }

    public static FetchResult empty() {
        return new FetchResult(Status.EMPTY, List.of(), "", "");
    }

    public static FetchResult failed(String error, String errorCategory) {
        return new FetchResult(Status.FAILED, List.of(), error, errorCategory == null ? "other" : errorCategory);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
