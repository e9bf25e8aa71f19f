package com.eli5y.domain.formula.model;

public enum DiagnosticType {
    MALFORMED_COMPONENT,
    COUNTERPART_MERGED,
    GLUE_DROPPED,
    COUNTERPART_MISSING,
    COUNTERPART_NOT_FOUND,
    NO_SYMBOLS,
    SYMBOL_BLANK,
    SYMBOL_NOT_FOUND,
    NO_SYMBOLS_LOCATED;

    /**
     * Whether this diagnostic records the removal of a whole component.
     */
    public boolean dropsComponent() {
        return this == GLUE_DROPPED
                || this == COUNTERPART_MISSING
                || this == COUNTERPART_NOT_FOUND
                || this == NO_SYMBOLS
                || this == NO_SYMBOLS_LOCATED;
    }
}
