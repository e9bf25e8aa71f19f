package com.eli5y.domain.formula.model;

import java.util.List;

/**
 * Noisy first draft of the formula explanation, after ingress normalization.
 *
 * @param explanation the one-sentence narrative
 * @param components  draft components in the order the model produced them
 * @param ingressIssues problems found while reading the draft shape
 */
public record FormulaDraft(
        String explanation,
        List<RawComponent> components,
        List<AlignmentDiagnostic> ingressIssues
) {
    public FormulaDraft {
        components = components == null ? List.of() : List.copyOf(components);
        ingressIssues = ingressIssues == null ? List.of() : List.copyOf(ingressIssues);
    }

    public FormulaDraft(String explanation, List<RawComponent> components) {
        this(explanation, components, List.of());
    }
}
