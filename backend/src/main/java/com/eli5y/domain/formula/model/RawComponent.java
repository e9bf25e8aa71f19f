package com.eli5y.domain.formula.model;

import java.util.List;

/**
 * Draft component as proposed by the language model.
 *
 * @param symbols     markup substrings claimed by the model, in the order given (may repeat or overlap)
 * @param counterpart the narrative phrase the model claims these symbols correspond to (trimmed at ingress)
 * @param role        optional plain-English role, null when the draft did not provide one
 */
public record RawComponent(
        List<String> symbols,
        String counterpart,
        String role
) {
    public RawComponent {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        counterpart = counterpart == null ? "" : counterpart;
    }

    public RawComponent(List<String> symbols, String counterpart) {
        this(symbols, counterpart, null);
    }

    /**
     * Symbols joined by a single space, used when checking whether glue is already expressed here.
     */
    public String joinedSymbols() {
        return String.join(" ", symbols);
    }

    public RawComponent withSymbols(List<String> newSymbols) {
        return new RawComponent(newSymbols, counterpart, role);
    }
}
