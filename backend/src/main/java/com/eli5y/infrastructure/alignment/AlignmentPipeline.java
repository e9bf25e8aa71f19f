package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.domain.formula.model.RawComponent;
import com.eli5y.domain.formula.model.ResolvedComponent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aligns a noisy explanation draft with its formula:
 * <p>
 * mask commands → normalize components → locate spans → build hierarchy → assemble groups
 * </p>
 * Pure and synchronous; every call works on its own {@link AlignmentContext}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlignmentPipeline {

    private final CommandMasker commandMasker;
    private final ComponentNormalizer componentNormalizer;
    private final SpanLocator spanLocator;
    private final HierarchyBuilder hierarchyBuilder;
    private final GroupAssembler groupAssembler;

    /**
     * Align a draft against the markup it explains.
     *
     * @param latex the original markup
     * @param draft the draft produced upstream
     * @return the groups, or a {@link AlignmentResult.Status#NO_COMPONENTS} result if none survive
     */
    public AlignmentResult align(String latex, FormulaDraft draft) {
        AlignmentContext ctx = new AlignmentContext();
        ctx.setLatex(latex == null ? "" : latex);
        ctx.setNarrative(draft.explanation() == null ? "" : draft.explanation());
        ctx.setDraftComponents(new ArrayList<>(draft.components()));
        ctx.getDiagnostics().addAll(draft.ingressIssues());

        // 1. Mask command names once for all components
        ctx.setCommandMask(commandMasker.mask(ctx.getLatex()));

        // 2. Merge duplicates and drop glue
        normalize(ctx);

        // 3. Anchor phrases and symbols
        locate(ctx);

        // 4. Direct children from range containment
        ctx.setChildren(hierarchyBuilder.buildChildren(ctx.getResolvedComponents()));

        // 5. Package
        ctx.setResult(groupAssembler.assemble(
                ctx.getNarrative(), ctx.getResolvedComponents(), ctx.getChildren(), ctx.getDiagnostics()));

        logSummary(ctx);
        return ctx.getResult();
    }

    private void normalize(AlignmentContext ctx) {
        ComponentNormalizer.NormalizationResult normalized = componentNormalizer.normalize(ctx.getDraftComponents());
        ctx.setNormalizedComponents(normalized.components());
        ctx.getDiagnostics().addAll(normalized.diagnostics());
    }

    private void locate(AlignmentContext ctx) {
        List<ResolvedComponent> resolved = new ArrayList<>();
        for (RawComponent component : ctx.getNormalizedComponents()) {
            Optional<ResolvedComponent> located = spanLocator.locate(
                    component, ctx.getLatex(), ctx.getNarrative(), ctx.getCommandMask(), ctx.getDiagnostics());
            located.ifPresent(resolved::add);
        }
        ctx.setResolvedComponents(resolved);
    }

    private void logSummary(AlignmentContext ctx) {
        List<AlignmentDiagnostic> diagnostics = ctx.getDiagnostics();
        long droppedComponents = diagnostics.stream().filter(d -> d.type().dropsComponent()).count();

        log.info("[Alignment] {} draft → {} normalized → {} groups ({} dropped, {} diagnostics)",
                ctx.getDraftComponents().size(),
                ctx.getNormalizedComponents().size(),
                ctx.getResolvedComponents().size(),
                droppedComponents,
                diagnostics.size());

        if (!ctx.getResult().hasGroups()) {
            log.warn("[Alignment] No component could be grounded in latex='{}'", abbreviate(ctx.getLatex()));
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
