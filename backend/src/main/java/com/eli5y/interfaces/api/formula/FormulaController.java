package com.eli5y.interfaces.api.formula;

import com.eli5y.application.formula.FormulaAppService;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.infrastructure.ai.AiDraftException;
import com.eli5y.infrastructure.ai.DraftParser;
import com.eli5y.interfaces.api.dto.AlignRequest;
import com.eli5y.interfaces.api.dto.ExplainRequest;
import com.eli5y.interfaces.api.dto.ExplanationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FormulaController {

    private final FormulaAppService formulaAppService;
    private final DraftParser draftParser;

    @PostMapping("/parse")
    public ResponseEntity<ExplanationResponse> parse(@Valid @RequestBody ExplainRequest request) {
        AlignmentResult result = formulaAppService.explain(request.latex());
        return ResponseEntity.ok(ExplanationResponse.from(request.latex(), result));
    }

    @PostMapping("/align")
    public ResponseEntity<ExplanationResponse> align(@Valid @RequestBody AlignRequest request) {
        FormulaDraft draft;
        try {
            draft = draftParser.fromNode(request.draft());
        } catch (AiDraftException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        AlignmentResult result = formulaAppService.align(request.latex(), draft);
        return ResponseEntity.ok(ExplanationResponse.from(request.latex(), result));
    }
}
