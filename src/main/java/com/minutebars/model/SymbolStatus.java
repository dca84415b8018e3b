package com.minutebars.model;

public enum SymbolStatus {
    ALREADY_CURRENT,
    SYNCED,
    EMPTY,
    FETCH_FAILED,
    PERSIST_FAILED
}
