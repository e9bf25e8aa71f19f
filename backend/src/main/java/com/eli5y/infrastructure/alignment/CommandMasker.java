package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.CommandMask;
import org.springframework.stereotype.Component;

import java.util.BitSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marks the character ranges of a markup string that belong to command-name tokens,
 * so that symbol search can skip matches inside names like {@code \mathrm} or {@code \sum}.
 * The braced argument of a text-style command is recorded separately; letters there are
 * upright text, and symbol search only falls back to them.
 */
@Component
public class CommandMasker {

    // Backslash followed by letters/@, or a dangling backslash at the end of the string
    private static final Pattern COMMAND_NAME = Pattern.compile("\\\\(?:[A-Za-z@]+|\\z)");

    // \mathrm{d}, \text{if}, \operatorname*{arg max}: group 1 is the braced argument
    private static final Pattern TEXT_ARGUMENT = Pattern.compile(
            "\\\\(?:mathrm|text|textrm|textit|operatorname)\\*?\\s*(\\{[^{}]*\\})");

    /**
     * Build the command mask for the given markup.
     *
     * @param latex the markup string
     * @return a mask of the same length; empty for null or empty input
     */
    public CommandMask mask(String latex) {
        if (latex == null || latex.isEmpty()) {
            return CommandMask.empty(0);
        }

        BitSet masked = new BitSet(latex.length());
        Matcher matcher = COMMAND_NAME.matcher(latex);
        while (matcher.find()) {
            masked.set(matcher.start(), matcher.end());
        }

        BitSet textArguments = new BitSet(latex.length());
        Matcher argument = TEXT_ARGUMENT.matcher(latex);
        while (argument.find()) {
            textArguments.set(argument.start(1), argument.end(1));
        }

        return new CommandMask(masked, textArguments, latex.length());
    }
}
