package com.eli5y.interfaces.api.dto;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.SemanticGroup;
import com.eli5y.domain.formula.model.Span;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExplanationResponse(
        String latex,
        String narrative,
        List<GroupEntry> groups,
        List<DiagnosticEntry> diagnostics
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GroupEntry(
            List<List<Integer>> ranges,
            List<String> latex,
            String label,
            String role,
            @JsonProperty("narrative_span") List<Integer> narrativeSpan,
            List<Integer> children
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DiagnosticEntry(String type, String counterpart, String symbol, String reason) {}

    public static ExplanationResponse from(String latex, AlignmentResult result) {
        return new ExplanationResponse(
                latex,
                result.narrative(),
                result.groups().stream().map(ExplanationResponse::toEntry).toList(),
                fromDiagnostics(result.diagnostics()));
    }

    public static List<DiagnosticEntry> fromDiagnostics(List<AlignmentDiagnostic> diagnostics) {
        return diagnostics.stream()
                .map(d -> new DiagnosticEntry(d.type().name(), d.counterpart(), d.symbol(), d.reason()))
                .toList();
    }

    private static GroupEntry toEntry(SemanticGroup group) {
        return new GroupEntry(
                group.ranges().stream().map(ExplanationResponse::pair).toList(),
                group.latex(),
                group.label(),
                group.role(),
                pair(group.narrativeSpan()),
                group.children());
    }

    private static List<Integer> pair(Span span) {
        return List.of(span.start(), span.end());
    }
}
