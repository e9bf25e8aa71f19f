package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.LocatedSymbol;
import com.eli5y.domain.formula.model.ResolvedComponent;
import com.eli5y.domain.formula.model.SemanticGroup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Packages located components into output groups, keeping their normalized order.
 */
@Component
public class GroupAssembler {

    public AlignmentResult assemble(String narrative,
                                    List<ResolvedComponent> components,
                                    List<List<Integer>> children,
                                    List<AlignmentDiagnostic> diagnostics) {
        if (components.isEmpty()) {
            return AlignmentResult.noComponents(narrative, diagnostics);
        }
        if (children.size() != components.size()) {
            throw new IllegalArgumentException("Expected child lists for " + components.size()
                    + " components, got " + children.size());
        }

        List<SemanticGroup> groups = new ArrayList<>(components.size());
        for (int i = 0; i < components.size(); i++) {
            ResolvedComponent component = components.get(i);
            groups.add(new SemanticGroup(
                    i,
                    component.symbols().stream().map(LocatedSymbol::span).toList(),
                    component.symbols().stream().map(LocatedSymbol::text).toList(),
                    component.component().counterpart(),
                    component.component().role(),
                    component.narrativeSpan(),
                    children.get(i)
            ));
        }

        return AlignmentResult.aligned(narrative, groups, diagnostics);
    }
}
