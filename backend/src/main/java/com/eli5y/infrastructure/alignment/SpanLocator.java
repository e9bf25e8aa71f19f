package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.CommandMask;
import com.eli5y.domain.formula.model.DiagnosticType;
import com.eli5y.domain.formula.model.LocatedSymbol;
import com.eli5y.domain.formula.model.RawComponent;
import com.eli5y.domain.formula.model.ResolvedComponent;
import com.eli5y.domain.formula.model.Span;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Anchors components to exact character offsets.
 * <p>
 * Both the counterpart and each symbol are matched at their first acceptable occurrence only;
 * a later occurrence is never preferred, even when it is the one the model meant.
 * </p>
 */
@Slf4j
@Component
public class SpanLocator {

    private static final char COMMAND_MARKER = '\\';

    /**
     * Locate one component.
     *
     * @param component   normalized draft component
     * @param latex       the markup string
     * @param narrative   the narrative string
     * @param mask        command mask of {@code latex}
     * @param diagnostics sink for skipped symbols and dropped components
     * @return the resolved component, or empty if the counterpart or every symbol failed
     */
    public Optional<ResolvedComponent> locate(RawComponent component,
                                              String latex,
                                              String narrative,
                                              CommandMask mask,
                                              List<AlignmentDiagnostic> diagnostics) {
        String counterpart = component.counterpart();

        if (counterpart.isBlank()) {
            diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.COUNTERPART_MISSING, counterpart,
                    "Component has no counterpart phrase"));
            return Optional.empty();
        }

        int narrativeStart = narrative.indexOf(counterpart);
        if (narrativeStart < 0) {
            log.warn("[Locator] Counterpart not found in narrative, dropping component: '{}'", counterpart);
            diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.COUNTERPART_NOT_FOUND, counterpart,
                    "Counterpart is not a verbatim phrase of the narrative"));
            return Optional.empty();
        }
        Span narrativeSpan = new Span(narrativeStart, narrativeStart + counterpart.length());

        if (component.symbols().isEmpty()) {
            diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.NO_SYMBOLS, counterpart,
                    "Component lists no symbols"));
            return Optional.empty();
        }

        List<LocatedSymbol> located = new ArrayList<>();
        for (String symbol : component.symbols()) {
            if (symbol.isBlank()) {
                diagnostics.add(AlignmentDiagnostic.ofSymbol(DiagnosticType.SYMBOL_BLANK, counterpart, symbol,
                        "Blank symbol skipped"));
                continue;
            }

            int start = findSymbol(latex, symbol, mask);
            if (start < 0) {
                log.debug("[Locator] Symbol '{}' not found in markup (counterpart '{}')", symbol, counterpart);
                diagnostics.add(AlignmentDiagnostic.ofSymbol(DiagnosticType.SYMBOL_NOT_FOUND, counterpart, symbol,
                        "Symbol does not occur in the markup outside command names"));
                continue;
            }
            located.add(new LocatedSymbol(new Span(start, start + symbol.length()), symbol));
        }

        if (located.isEmpty()) {
            log.warn("[Locator] No symbol of component '{}' could be located, dropping it", counterpart);
            diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.NO_SYMBOLS_LOCATED, counterpart,
                    "None of " + component.symbols() + " occur in the markup"));
            return Optional.empty();
        }

        return Optional.of(new ResolvedComponent(component, narrativeSpan, located));
    }

    /**
     * First occurrence of {@code symbol} in {@code latex}.
     * Symbols that name a command themselves are searched plainly. All others skip any candidate
     * that touches a command name, resuming one character further on, and prefer a candidate
     * outside text-style arguments: {@code m} in {@code \mathrm{m}^{m}} resolves to the exponent.
     *
     * @return the start offset, or -1
     */
    int findSymbol(String latex, String symbol, CommandMask mask) {
        if (symbol.indexOf(COMMAND_MARKER) >= 0) {
            return latex.indexOf(symbol);
        }

        int free = scan(latex, symbol, mask, true);
        return free >= 0 ? free : scan(latex, symbol, mask, false);
    }

    private int scan(String latex, String symbol, CommandMask mask, boolean skipTextArguments) {
        int from = 0;
        while (from <= latex.length() - symbol.length()) {
            int candidate = latex.indexOf(symbol, from);
            if (candidate < 0) {
                return -1;
            }
            int end = candidate + symbol.length();
            boolean rejected = mask.overlaps(candidate, end)
                    || (skipTextArguments && mask.overlapsTextArgument(candidate, end));
            if (!rejected) {
                return candidate;
            }
            from = candidate + 1;
        }
        return -1;
    }
}
