package com.eli5y.domain.formula.model;

/**
 * Record of something the engine merged, skipped or dropped while aligning a draft.
 *
 * @param type        what happened
 * @param counterpart the counterpart of the affected component (may be blank)
 * @param symbol      the affected symbol, or null when the whole component is concerned
 * @param reason      human-readable description
 */
public record AlignmentDiagnostic(
        DiagnosticType type,
        String counterpart,
        String symbol,
        String reason
) {
    public static AlignmentDiagnostic ofComponent(DiagnosticType type, String counterpart, String reason) {
        return new AlignmentDiagnostic(type, counterpart, null, reason);
    }

    public static AlignmentDiagnostic ofSymbol(DiagnosticType type, String counterpart, String symbol, String reason) {
        return new AlignmentDiagnostic(type, counterpart, symbol, reason);
    }
}
