package com.eli5y.domain.formula.model;

import java.util.List;

/**
 * Final, span-anchored unit handed to the UI for highlighting.
 *
 * @param index         position of this group in the output list
 * @param ranges        markup spans, one per located symbol
 * @param latex         markup substrings matching {@code ranges} one-to-one
 * @param label         the counterpart phrase
 * @param role          the draft's role text, or null
 * @param narrativeSpan where {@code label} occurs in the narrative
 * @param children      indices of direct child groups in the same output list
 */
public record SemanticGroup(
        int index,
        List<Span> ranges,
        List<String> latex,
        String label,
        String role,
        Span narrativeSpan,
        List<Integer> children
) {
    public SemanticGroup {
        ranges = List.copyOf(ranges);
        latex = List.copyOf(latex);
        children = List.copyOf(children);
    }
}
