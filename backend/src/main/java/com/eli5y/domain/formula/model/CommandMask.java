package com.eli5y.domain.formula.model;

import java.util.BitSet;

/**
 * Per-character flags over a markup string.
 * <p>
 * Command-name positions ({@code \mathrm}, {@code \sum}) are never matchable by a bare symbol.
 * Positions inside the braced argument of a text-style command ({@code \mathrm{d}},
 * {@code \text{if}}) are matchable, but only when no other occurrence is free.
 * </p>
 * Immutable once built.
 */
public final class CommandMask {

    private final BitSet masked;
    private final BitSet textArguments;
    private final int length;

    public CommandMask(BitSet masked, BitSet textArguments, int length) {
        this.masked = (BitSet) masked.clone();
        this.textArguments = (BitSet) textArguments.clone();
        this.length = length;
    }

    public static CommandMask empty(int length) {
        return new CommandMask(new BitSet(length), new BitSet(length), length);
    }

    public int length() {
        return length;
    }

    public boolean isMasked(int position) {
        return masked.get(position);
    }

    /**
     * True if any position in {@code [start, end)} belongs to a command name.
     */
    public boolean overlaps(int start, int end) {
        return anySet(masked, start, end);
    }

    /**
     * True if any position in {@code [start, end)} lies in the argument of a text-style command.
     */
    public boolean overlapsTextArgument(int start, int end) {
        return anySet(textArguments, start, end);
    }

    public int maskedCount() {
        return masked.cardinality();
    }

    private static boolean anySet(BitSet bits, int start, int end) {
        int next = bits.nextSetBit(start);
        return next >= 0 && next < end;
    }
}
