package io.github.flameyossnowy.kvmodels.api.store;

/**
 * How record keys of a model are enumerated before a query.
 */
public enum KeyEnumeration {
    /**
     * One blocking listing call.
     */
    KEYS,

    /**
     * Cursor-based incremental iteration.
     */
    SCAN
}
