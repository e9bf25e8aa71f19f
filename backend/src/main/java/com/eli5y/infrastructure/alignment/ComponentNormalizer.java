package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.DiagnosticType;
import com.eli5y.domain.formula.model.RawComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Repairs the two common draft failures before anything is located:
 * <ol>
 *   <li>one idea split into several components quoting the same phrase (merged into one)</li>
 *   <li>bare operators and exponents proposed as components of their own (dropped when a
 *       sibling already contains them)</li>
 * </ol>
 */
@Slf4j
@Component
public class ComponentNormalizer {

    // Bare operators, arrows and relations
    private static final Set<String> SYNTACTIC_GLUE = Set.of(
            "+", "-", "=", "\\cdot", "\\times", "\\div", "\\pm", "\\mp",
            "\\longleftarrow", "\\leftarrow", "\\rightarrow", "\\longrightarrow",
            "\\Longleftarrow", "\\Rightarrow", "\\Longrightarrow",
            "\\approx", "\\neq", "\\leq", "\\geq", "\\equiv", "\\sim", "\\propto"
    );

    // Bare exponent/subscript: ^{2}, _{i}, ^{n+1}, ^2, _i
    private static final Pattern BARE_MODIFIER = Pattern.compile(
            "[\\^_]\\{[^{}]*\\}|[\\^_][a-zA-Z0-9]"
    );

    /**
     * Merge duplicate counterparts, then drop glue components that have a parent.
     *
     * @param components draft components in model order
     * @return surviving components in first-seen order, with a record of every merge and drop
     */
    public NormalizationResult normalize(List<RawComponent> components) {
        List<AlignmentDiagnostic> diagnostics = new ArrayList<>();

        List<RawComponent> merged = mergeDuplicateCounterparts(components, diagnostics);
        if (merged.size() < 2) {
            return new NormalizationResult(merged, diagnostics);
        }

        List<RawComponent> kept = dropSyntacticGlue(merged, diagnostics);
        return new NormalizationResult(kept, diagnostics);
    }

    /**
     * Whether a single symbol is syntactic glue (bare operator or bare modifier).
     */
    public static boolean isSyntacticGlue(String symbol) {
        String stripped = symbol.strip();
        return SYNTACTIC_GLUE.contains(stripped) || BARE_MODIFIER.matcher(stripped).matches();
    }

    static boolean isGlueOnly(RawComponent component) {
        return !component.symbols().isEmpty()
                && component.symbols().stream().allMatch(ComponentNormalizer::isSyntacticGlue);
    }

    private List<RawComponent> mergeDuplicateCounterparts(List<RawComponent> components,
                                                          List<AlignmentDiagnostic> diagnostics) {
        // counterpart -> position in the merged list; blank counterparts never merge
        Map<String, Integer> seen = new LinkedHashMap<>();
        List<RawComponent> merged = new ArrayList<>();

        for (RawComponent component : components) {
            String key = component.counterpart().strip();
            if (key.isEmpty()) {
                merged.add(component);
                continue;
            }

            Integer existingIndex = seen.get(key);
            if (existingIndex == null) {
                seen.put(key, merged.size());
                merged.add(component);
                continue;
            }

            RawComponent existing = merged.get(existingIndex);
            Set<String> combined = new LinkedHashSet<>(existing.symbols());
            combined.addAll(component.symbols());
            RawComponent union = existing.withSymbols(List.copyOf(combined));
            merged.set(existingIndex, union);

            log.info("[Normalizer] Merged duplicate counterpart '{}': {}", key, union.symbols());
            diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.COUNTERPART_MERGED, key,
                    "Merged symbols " + component.symbols() + " into the first component with this counterpart"));
        }

        return merged;
    }

    private List<RawComponent> dropSyntacticGlue(List<RawComponent> components,
                                                 List<AlignmentDiagnostic> diagnostics) {
        boolean[] dropped = new boolean[components.size()];

        for (int i = 0; i < components.size(); i++) {
            RawComponent candidate = components.get(i);
            if (isGlueOnly(candidate) && findParent(candidate, i, components, dropped) >= 0) {
                dropped[i] = true;
                diagnostics.add(AlignmentDiagnostic.ofComponent(DiagnosticType.GLUE_DROPPED,
                        candidate.counterpart(),
                        "Glue symbols " + candidate.symbols() + " already appear inside another component"));
            }
        }

        List<RawComponent> kept = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            if (!dropped[i]) {
                kept.add(components.get(i));
            }
        }

        int droppedCount = components.size() - kept.size();
        if (droppedCount > 0) {
            log.info("[Normalizer] Dropped {} glue component(s)", droppedCount);
        }
        return kept;
    }

    /**
     * Index of a component still present whose joined symbols contain every symbol of {@code glue}, or -1.
     * Glue components qualify as parents too ({@code +} inside {@code ^{n+1}}). A component already
     * dropped does not, so of two identical glue components the later one survives.
     */
    private int findParent(RawComponent glue, int glueIndex, List<RawComponent> components, boolean[] dropped) {
        for (int j = 0; j < components.size(); j++) {
            if (j == glueIndex || dropped[j]) {
                continue;
            }
            String joined = components.get(j).joinedSymbols();
            boolean expressesAll = glue.symbols().stream()
                    .allMatch(symbol -> joined.contains(symbol.strip()));
            if (expressesAll) {
                return j;
            }
        }
        return -1;
    }

    /**
     * @param components  surviving components in first-seen order
     * @param diagnostics merges and glue drops performed
     */
    public record NormalizationResult(List<RawComponent> components, List<AlignmentDiagnostic> diagnostics) {}
}
