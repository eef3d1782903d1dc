package io.github.flameyossnowy.kvmodels.api.field;

public enum FieldKind {
    STRING,
    NUMBER,
    BOOLEAN,
    DECIMAL,
    JSON,
    DATE_TIME,
    DATE,
    REFERENCE,
    REFERENCE_LIST,

    /**
     * Values of a model the registry does not know, kept exactly as they were decoded.
     */
    OPAQUE
}
