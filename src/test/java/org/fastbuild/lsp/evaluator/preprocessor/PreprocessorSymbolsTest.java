package org.fastbuild.lsp.evaluator.preprocessor;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the symbol table of {@code #define}, {@code #undef} and {@code #if}.
 */
public class PreprocessorSymbolsTest {

    private static final SourceRange RANGE = SourceRange.of("file:///fbuild.bff", 0, 8, 0, 11);

    /**
     * Verifies that only the symbol of the configured platform is predefined.
     */
    @Test
    @Tag("unit")
    void testPlatformSymbolIsPredefined() {
        // Act
        PreprocessorSymbols symbols = new PreprocessorSymbols(Platform.OSX);

        // Assert
        assertThat(symbols.isDefined("__OSX__")).isTrue();
        assertThat(symbols.isDefined("__LINUX__")).isFalse();
        assertThat(symbols.isDefined("__WINDOWS__")).isFalse();
    }

    /**
     * Verifies that symbols can be defined and undefined again, and that redefinition is an error.
     */
    @Test
    @Tag("unit")
    void testDefineAndUndefine() throws EvaluationException {
        // Arrange
        PreprocessorSymbols symbols = new PreprocessorSymbols(Platform.LINUX);

        // Act
        symbols.define("FOO", RANGE);

        // Assert
        assertThat(symbols.isDefined("FOO")).isTrue();
        assertThatThrownBy(() -> symbols.define("FOO", RANGE))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Cannot #define already defined symbol \"FOO\".");
        symbols.undefine("FOO", RANGE);
        assertThat(symbols.isDefined("FOO")).isFalse();
    }

    /**
     * Verifies that the platform symbol is protected and that undefining an unknown symbol fails.
     */
    @Test
    @Tag("unit")
    void testUndefineErrors() {
        // Arrange
        PreprocessorSymbols symbols = new PreprocessorSymbols(Platform.WINDOWS);

        // Act & Assert
        assertThatThrownBy(() -> symbols.undefine("__WINDOWS__", RANGE))
                .hasMessage("Cannot #undef built-in symbol \"__WINDOWS__\".");
        assertThatThrownBy(() -> symbols.undefine("BAR", RANGE))
                .hasMessage("Cannot #undef undefined symbol \"BAR\".");
        assertThatThrownBy(() -> symbols.define("__WINDOWS__", RANGE))
                .hasMessage("Cannot #define already defined symbol \"__WINDOWS__\".");
    }
}
