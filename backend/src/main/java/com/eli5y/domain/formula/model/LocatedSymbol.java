package com.eli5y.domain.formula.model;

/**
 * A markup symbol anchored at its first acceptable occurrence.
 *
 * @param span where the symbol was found in the markup
 * @param text the matched substring, equal to {@code markup.substring(span.start(), span.end())}
 */
public record LocatedSymbol(Span span, String text) {}
