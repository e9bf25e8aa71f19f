package com.eli5y.application.formula;

import com.eli5y.application.formula.exception.FormulaNotExplainableException;
import com.eli5y.application.formula.exception.FormulaTooLongException;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.domain.formula.service.DraftService;
import com.eli5y.infrastructure.alignment.AlignmentPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FormulaAppService {

    private final DraftService draftService;
    private final AlignmentPipeline alignmentPipeline;

    @Value("${formula.max-latex-length}")
    private int maxLatexLength;

    /**
     * Draft an explanation with the model, then align it with the formula.
     *
     * @throws FormulaNotExplainableException if no component survives alignment
     */
    public AlignmentResult explain(String latex) {
        validateLatex(latex);

        FormulaDraft draft = draftService.draft(latex);
        if (draft.components().isEmpty()) {
            throw new FormulaNotExplainableException(
                    "No components identified; the LaTeX may be malformed.", draft.ingressIssues());
        }

        return align(latex, draft);
    }

    /**
     * Align a draft that was produced earlier.
     *
     * @throws FormulaNotExplainableException if no component survives alignment
     */
    public AlignmentResult align(String latex, FormulaDraft draft) {
        validateLatex(latex);

        AlignmentResult result = alignmentPipeline.align(latex, draft);

        if (!result.diagnostics().isEmpty()) {
            log.info("Alignment diagnostics: {}", result.diagnostics().stream()
                    .map(d -> d.type() + ":'" + d.counterpart() + "'" + (d.symbol() != null ? "/'" + d.symbol() + "'" : ""))
                    .toList());
        }

        if (!result.hasGroups()) {
            throw new FormulaNotExplainableException(
                    "The explanation could not be grounded in the formula.", result.diagnostics());
        }
        return result;
    }

    private void validateLatex(String latex) {
        if (latex == null || latex.isBlank()) {
            throw new IllegalArgumentException("LaTeX is required");
        }
        if (latex.length() > maxLatexLength) {
            throw new FormulaTooLongException(
                    String.format("LaTeX must not exceed %d characters.", maxLatexLength));
        }
    }
}
