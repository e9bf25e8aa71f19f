package com.eli5y.application.formula;

import com.eli5y.application.formula.exception.FormulaNotExplainableException;
import com.eli5y.application.formula.exception.FormulaTooLongException;
import com.eli5y.domain.formula.model.AlignmentResult;
import com.eli5y.domain.formula.model.DiagnosticType;
import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.domain.formula.model.RawComponent;
import com.eli5y.domain.formula.service.DraftService;
import com.eli5y.infrastructure.alignment.AlignmentPipeline;
import com.eli5y.infrastructure.alignment.CommandMasker;
import com.eli5y.infrastructure.alignment.ComponentNormalizer;
import com.eli5y.infrastructure.alignment.GroupAssembler;
import com.eli5y.infrastructure.alignment.HierarchyBuilder;
import com.eli5y.infrastructure.alignment.SpanLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormulaAppServiceTest {

    private static final String LATEX = "(y_i-f(x_i))^2";
    private static final String NARRATIVE = "Measure the miss, then square it to punish big errors.";

    @Mock
    private DraftService draftService;

    private FormulaAppService service;

    @BeforeEach
    void setUp() throws Exception {
        AlignmentPipeline pipeline = new AlignmentPipeline(
                new CommandMasker(), new ComponentNormalizer(), new SpanLocator(),
                new HierarchyBuilder(), new GroupAssembler());
        service = new FormulaAppService(draftService, pipeline);
        setField("maxLatexLength", 100);
    }

    private void setField(String name, int value) throws Exception {
        Field field = FormulaAppService.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(service, value);
    }

    @Test
    @DisplayName("explain: model draft is aligned into nested groups")
    void explain_success() {
        when(draftService.draft(LATEX)).thenReturn(new FormulaDraft(NARRATIVE, List.of(
                new RawComponent(List.of("(y_i-f(x_i))^2"), "punish big errors"),
                new RawComponent(List.of("y_i-f(x_i)"), "the miss"))));

        AlignmentResult result = service.explain(LATEX);

        assertThat(result.groups()).hasSize(2);
        assertThat(result.groups().get(0).children()).containsExactly(1);
    }

    @Test
    @DisplayName("explain: a draft with no components is not explainable")
    void explain_emptyDraft() {
        when(draftService.draft(LATEX)).thenReturn(new FormulaDraft(NARRATIVE, List.of()));

        assertThatThrownBy(() -> service.explain(LATEX))
                .isInstanceOf(FormulaNotExplainableException.class);
    }

    @Test
    @DisplayName("align: all components dropped surfaces as not explainable, with diagnostics")
    void align_allDropped() {
        FormulaDraft draft = new FormulaDraft(NARRATIVE, List.of(
                new RawComponent(List.of("z"), "the miss"),
                new RawComponent(List.of("y_i"), "the target value")));

        assertThatThrownBy(() -> service.align(LATEX, draft))
                .isInstanceOfSatisfying(FormulaNotExplainableException.class, e ->
                        assertThat(e.getDiagnostics()).extracting(d -> d.type()).containsExactly(
                                DiagnosticType.SYMBOL_NOT_FOUND,
                                DiagnosticType.NO_SYMBOLS_LOCATED,
                                DiagnosticType.COUNTERPART_NOT_FOUND));
    }

    @Test
    @DisplayName("explain: too long LaTeX is rejected before calling the model")
    void explain_tooLong() {
        String latex = "x".repeat(101);

        assertThatThrownBy(() -> service.explain(latex))
                .isInstanceOf(FormulaTooLongException.class)
                .hasMessageContaining("100");
        verify(draftService, never()).draft(anyString());
    }

    @Test
    @DisplayName("explain: blank LaTeX is an invalid argument")
    void explain_blank() {
        assertThatThrownBy(() -> service.explain("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
