package com.eli5y.domain.formula.model;

import java.util.List;

/**
 * Outcome of one alignment run.
 * An {@link Status#ALIGNED} result always has at least one group;
 * when nothing survives the result is {@link Status#NO_COMPONENTS} instead.
 *
 * @param status      whether any group survived
 * @param narrative   the narrative string, unchanged
 * @param groups      surviving groups in normalized order
 * @param diagnostics everything merged, skipped or dropped along the way
 */
public record AlignmentResult(
        Status status,
        String narrative,
        List<SemanticGroup> groups,
        List<AlignmentDiagnostic> diagnostics
) {
    public enum Status {
        ALIGNED,
        NO_COMPONENTS
    }

    public AlignmentResult {
        groups = List.copyOf(groups);
        diagnostics = List.copyOf(diagnostics);
        if (status == Status.ALIGNED && groups.isEmpty()) {
            throw new IllegalArgumentException("An aligned result needs at least one group");
        }
        if (status == Status.NO_COMPONENTS && !groups.isEmpty()) {
            throw new IllegalArgumentException("A no-components result cannot carry groups");
        }
    }

    public static AlignmentResult aligned(String narrative, List<SemanticGroup> groups,
                                          List<AlignmentDiagnostic> diagnostics) {
        return new AlignmentResult(Status.ALIGNED, narrative, groups, diagnostics);
    }

    public static AlignmentResult noComponents(String narrative, List<AlignmentDiagnostic> diagnostics) {
        return new AlignmentResult(Status.NO_COMPONENTS, narrative, List.of(), diagnostics);
    }

    public boolean hasGroups() {
        return status == Status.ALIGNED;
    }
}
