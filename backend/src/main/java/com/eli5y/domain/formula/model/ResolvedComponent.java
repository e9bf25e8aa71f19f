package com.eli5y.domain.formula.model;

import java.util.List;

/**
 * A component whose counterpart and at least one symbol were found in the source strings.
 *
 * @param component     the normalized draft component
 * @param narrativeSpan first occurrence of the counterpart in the narrative
 * @param symbols       located symbols in the order the component listed them; never empty
 */
public record ResolvedComponent(
        RawComponent component,
        Span narrativeSpan,
        List<LocatedSymbol> symbols
) {
    public ResolvedComponent {
        symbols = List.copyOf(symbols);
    }

    public List<Span> ranges() {
        return symbols.stream().map(LocatedSymbol::span).toList();
    }

    /**
     * True if any range of {@code other} is strictly inside any range of this component.
     */
    public boolean contains(ResolvedComponent other) {
        for (Span outer : ranges()) {
            for (Span inner : other.ranges()) {
                if (outer.strictlyContains(inner)) {
                    return true;
                }
            }
        }
        return false;
    }
}
