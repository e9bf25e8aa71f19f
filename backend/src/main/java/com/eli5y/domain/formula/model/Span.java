package com.eli5y.domain.formula.model;

/**
 * Half-open character interval {@code [start, end)} into a markup or narrative string.
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * True if {@code other} lies inside this span and is strictly shorter.
     * Equal spans do not contain each other.
     */
    public boolean strictlyContains(Span other) {
        return start <= other.start && other.end <= end && length() > other.length();
    }

    public String slice(String text) {
        return text.substring(start, end);
    }
}
