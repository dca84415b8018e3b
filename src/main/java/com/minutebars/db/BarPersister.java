package com.minutebars.db;

import com.minutebars.model.ValidatedBar;

import java.util.List;

/**
 * Insert-if-absent writer for validated bars. One call is one transaction.
 */
public interface BarPersister {

    /**
     * Never throws; storage failures are reported through {@link PersistResult#committed}.
     */
    PersistResult persist(List<ValidatedBar> bars);
}
