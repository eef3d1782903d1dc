package io.github.flameyossnowy.kvmodels.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
