package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.DiagnosticType;
import com.eli5y.domain.formula.model.LocatedSymbol;
import com.eli5y.domain.formula.model.RawComponent;
import com.eli5y.domain.formula.model.ResolvedComponent;
import com.eli5y.domain.formula.model.Span;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SpanLocatorTest {

    private SpanLocator locator;
    private CommandMasker masker;
    private List<AlignmentDiagnostic> diagnostics;

    @BeforeEach
    void setUp() {
        locator = new SpanLocator();
        masker = new CommandMasker();
        diagnostics = new ArrayList<>();
    }

    private int find(String latex, String symbol) {
        return locator.findSymbol(latex, symbol, masker.mask(latex));
    }

    private Optional<ResolvedComponent> locate(RawComponent component, String latex, String narrative) {
        return locator.locate(component, latex, narrative, masker.mask(latex), diagnostics);
    }

    @Nested
    @DisplayName("Symbol search")
    class SymbolSearch {

        @Test
        @DisplayName("a bare letter resolves to the standalone occurrence, not to \\mathrm or its argument")
        void find_skipsCommandName() {
            assertThat(find("\\mathrm{m}^{m}", "m")).isEqualTo(12);
        }

        @Test
        @DisplayName("a letter that only occurs as a text argument is still found there")
        void find_textArgumentFallback() {
            assertThat(find("\\mathrm{d}x", "d")).isEqualTo(8);
            assertThat(find("\\operatorname{sign}(w)", "w")).isEqualTo(20);
        }

        @Test
        @DisplayName("arguments of other commands are ordinary markup")
        void find_mathArgumentNotSkipped() {
            assertThat(find("\\frac{m}{2} m", "m")).isEqualTo(6);
        }

        @Test
        @DisplayName("search resumes after a masked candidate and finds a later free occurrence")
        void find_laterOccurrence() {
            assertThat(find("\\sin(x) + n", "n")).isEqualTo(10);
        }

        @Test
        @DisplayName("a candidate partly inside a command name is rejected")
        void find_partialOverlapRejected() {
            assertThat(find("\\pi a", "i a")).isEqualTo(-1);
        }

        @Test
        @DisplayName("symbols containing a backslash are searched plainly")
        void find_commandSymbolPlain() {
            assertThat(find("X = \\frac{1}{N}", "\\frac{1}{N}")).isEqualTo(4);
            assertThat(find("2\\pi k", "\\pi")).isEqualTo(1);
        }

        @Test
        @DisplayName("only the first free occurrence is used, even if a later one was meant")
        void find_firstOccurrenceOnly() {
            assertThat(find("x + x^2", "x")).isZero();
        }

        @Test
        @DisplayName("missing symbol returns -1")
        void find_missing() {
            assertThat(find("a + b", "c")).isEqualTo(-1);
            assertThat(find("a", "abc")).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Component location")
    class ComponentLocation {

        private static final String LATEX = "x_n + y";
        private static final String NARRATIVE = "Add your signal to the offset.";

        @Test
        @DisplayName("counterpart and symbols are anchored to exact offsets")
        void locate_success() {
            Optional<ResolvedComponent> located = locate(
                    new RawComponent(List.of("x_n", "y"), "your signal"), LATEX, NARRATIVE);

            assertThat(located).isPresent();
            ResolvedComponent resolved = located.get();
            assertThat(resolved.narrativeSpan()).isEqualTo(new Span(4, 15));
            assertThat(resolved.symbols()).containsExactly(
                    new LocatedSymbol(new Span(0, 3), "x_n"),
                    new LocatedSymbol(new Span(6, 7), "y"));
            assertThat(diagnostics).isEmpty();
        }

        @Test
        @DisplayName("a paraphrased counterpart drops the component without throwing")
        void locate_counterpartNotFound() {
            Optional<ResolvedComponent> located = locate(
                    new RawComponent(List.of("x_n"), "the input signal"), LATEX, NARRATIVE);

            assertThat(located).isEmpty();
            assertThat(diagnostics).extracting(AlignmentDiagnostic::type)
                    .containsExactly(DiagnosticType.COUNTERPART_NOT_FOUND);
        }

        @Test
        @DisplayName("an unknown symbol is skipped while the rest of the component survives")
        void locate_partialSymbols() {
            Optional<ResolvedComponent> located = locate(
                    new RawComponent(List.of("\\zeta", "x_n"), "your signal"), LATEX, NARRATIVE);

            assertThat(located).isPresent();
            assertThat(located.get().symbols()).extracting(LocatedSymbol::text).containsExactly("x_n");
            assertThat(diagnostics).singleElement()
                    .satisfies(d -> {
                        assertThat(d.type()).isEqualTo(DiagnosticType.SYMBOL_NOT_FOUND);
                        assertThat(d.symbol()).isEqualTo("\\zeta");
                    });
        }

        @Test
        @DisplayName("a component whose symbols all fail is dropped")
        void locate_noSymbolsLocated() {
            Optional<ResolvedComponent> located = locate(
                    new RawComponent(List.of("z", "w"), "the offset"), LATEX, NARRATIVE);

            assertThat(located).isEmpty();
            assertThat(diagnostics).extracting(AlignmentDiagnostic::type).containsExactly(
                    DiagnosticType.SYMBOL_NOT_FOUND,
                    DiagnosticType.SYMBOL_NOT_FOUND,
                    DiagnosticType.NO_SYMBOLS_LOCATED);
        }

        @Test
        @DisplayName("blank counterpart, empty symbol list and blank symbols are handled as unlocatable")
        void locate_malformed() {
            assertThat(locate(new RawComponent(List.of("x_n"), ""), LATEX, NARRATIVE)).isEmpty();
            assertThat(locate(new RawComponent(List.of(), "your signal"), LATEX, NARRATIVE)).isEmpty();
            assertThat(locate(new RawComponent(List.of(" "), "your signal"), LATEX, NARRATIVE)).isEmpty();

            assertThat(diagnostics).extracting(AlignmentDiagnostic::type).containsExactly(
                    DiagnosticType.COUNTERPART_MISSING,
                    DiagnosticType.NO_SYMBOLS,
                    DiagnosticType.SYMBOL_BLANK,
                    DiagnosticType.NO_SYMBOLS_LOCATED);
        }

        @Test
        @DisplayName("the first occurrence of a repeated phrase is used")
        void locate_firstPhraseOccurrence() {
            Optional<ResolvedComponent> located = locate(
                    new RawComponent(List.of("y"), "sum"), "x + y", "sum the misses, then sum again");

            assertThat(located).isPresent();
            assertThat(located.get().narrativeSpan()).isEqualTo(new Span(0, 3));
        }
    }
}
