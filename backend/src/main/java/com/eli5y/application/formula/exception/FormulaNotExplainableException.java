package com.eli5y.application.formula.exception;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;

import java.util.List;

/**
 * No part of the draft could be grounded in the formula and its explanation.
 */
public class FormulaNotExplainableException extends RuntimeException {

    private final List<AlignmentDiagnostic> diagnostics;

    public FormulaNotExplainableException(String message, List<AlignmentDiagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<AlignmentDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
