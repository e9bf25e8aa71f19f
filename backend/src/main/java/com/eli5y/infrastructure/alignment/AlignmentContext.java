package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.CommandMask;
import com.eli5y.domain.formula.model.RawComponent;
import com.eli5y.domain.formula.model.ResolvedComponent;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one alignment run, filled in stage by stage.
 * Created per request and never shared.
 */
@Data
public class AlignmentContext {

    // --- Input ---
    private String latex;
    private String narrative;
    private List<RawComponent> draftComponents = new ArrayList<>();

    // --- Masking ---
    private CommandMask commandMask;

    // --- Normalization ---
    private List<RawComponent> normalizedComponents = new ArrayList<>();

    // --- Location ---
    private List<ResolvedComponent> resolvedComponents = new ArrayList<>();

    // --- Hierarchy ---
    private List<List<Integer>> children = new ArrayList<>();

    // --- Diagnostics from every stage ---
    private List<AlignmentDiagnostic> diagnostics = new ArrayList<>();

    private AlignmentResult result;
}
