package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.CommandMask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandMaskerTest {

    private CommandMasker masker;

    @BeforeEach
    void setUp() {
        masker = new CommandMasker();
    }

    @Test
    @DisplayName("mask covers backslash and letters of a command name, not its argument")
    void mask_commandName() {
        String latex = "\\frac{1}{N}";
        CommandMask mask = masker.mask(latex);

        assertThat(mask.length()).isEqualTo(latex.length());
        for (int i = 0; i < 5; i++) {
            assertThat(mask.isMasked(i)).as("position %d", i).isTrue();
        }
        for (int i = 5; i < latex.length(); i++) {
            assertThat(mask.isMasked(i)).as("position %d", i).isFalse();
        }
    }

    @Test
    @DisplayName("mask handles several commands and leaves the text between them free")
    void mask_multipleCommands() {
        CommandMask mask = masker.mask("\\alpha_1\\beta");

        assertThat(mask.overlaps(0, 6)).isTrue();
        assertThat(mask.isMasked(6)).isFalse();
        assertThat(mask.isMasked(7)).isFalse();
        assertThat(mask.isMasked(8)).isTrue();
        assertThat(mask.isMasked(12)).isTrue();
        assertThat(mask.maskedCount()).isEqualTo(11);
    }

    @Test
    @DisplayName("@ counts as a command-name letter")
    void mask_atSign() {
        CommandMask mask = masker.mask("\\make@letter x");

        assertThat(mask.maskedCount()).isEqualTo(12);
        assertThat(mask.isMasked(13)).isFalse();
    }

    @Test
    @DisplayName("a trailing backslash is masked up to the end without error")
    void mask_trailingBackslash() {
        CommandMask mask = masker.mask("x^2\\");

        assertThat(mask.isMasked(3)).isTrue();
        assertThat(mask.maskedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("control symbols like \\, are not command names")
    void mask_controlSymbol() {
        CommandMask mask = masker.mask("a\\,b");

        assertThat(mask.maskedCount()).isZero();
    }

    @Test
    @DisplayName("null and empty input produce an empty mask")
    void mask_empty() {
        assertThat(masker.mask(null).length()).isZero();
        assertThat(masker.mask("").length()).isZero();
    }

    @Test
    @DisplayName("overlaps reports partial coverage of a range")
    void overlaps_partial() {
        CommandMask mask = masker.mask("\\pi a");

        assertThat(mask.overlaps(2, 5)).isTrue();
        assertThat(mask.overlaps(3, 5)).isFalse();
    }

    @Test
    @DisplayName("text-style arguments are recorded apart from command names")
    void mask_textArgument() {
        CommandMask mask = masker.mask("\\mathrm{m}^{m}");

        assertThat(mask.maskedCount()).isEqualTo(7);
        assertThat(mask.isMasked(8)).isFalse();
        assertThat(mask.overlapsTextArgument(8, 9)).isTrue();
        assertThat(mask.overlapsTextArgument(12, 13)).isFalse();
    }

    @Test
    @DisplayName("only text-style commands get a text argument")
    void mask_textArgumentOnlyForTextCommands() {
        assertThat(masker.mask("\\frac{m}{2}").overlapsTextArgument(0, 11)).isFalse();
        assertThat(masker.mask("\\textbf{m}").overlapsTextArgument(0, 10)).isFalse();
        assertThat(masker.mask("\\operatorname*{arg max}").overlapsTextArgument(16, 19)).isTrue();
    }
}
