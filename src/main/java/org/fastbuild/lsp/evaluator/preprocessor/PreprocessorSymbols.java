package org.fastbuild.lsp.evaluator.preprocessor;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.HashSet;
import java.util.Set;

/**
 * The symbols defined for {@code #if}: the built-in platform symbol plus the ones added by
 * {@code #define}.
 */
public class PreprocessorSymbols {

    private final String builtInSymbol;
    private final Set<String> definedSymbols = new HashSet<>();

    public PreprocessorSymbols(Platform platform) {
        this.builtInSymbol = platform.symbol();
        this.definedSymbols.add(builtInSymbol);
    }

    public boolean isDefined(String symbol) {
        return definedSymbols.contains(symbol);
    }

    /**
     * Handles {@code #define}.
     * @param symbol The symbol.
     * @param range The range of the symbol, used for the error.
     * @throws EvaluationException if the symbol is already defined.
     */
    public void define(String symbol, SourceRange range) throws EvaluationException {
        if (!definedSymbols.add(symbol)) {
            throw new EvaluationException("Cannot #define already defined symbol \"" + symbol + "\".", range);
        }
    }

    /**
     * Handles {@code #undef}.
     * @param symbol The symbol.
     * @param range The range of the symbol, used for the error.
     * @throws EvaluationException if the symbol is built in or not defined.
     */
    public void undefine(String symbol, SourceRange range) throws EvaluationException {
        if (symbol.equals(builtInSymbol)) {
            throw new EvaluationException("Cannot #undef built-in symbol \"" + symbol + "\".", range);
        }
        if (!definedSymbols.remove(symbol)) {
            throw new EvaluationException("Cannot #undef undefined symbol \"" + symbol + "\".", range);
        }
    }
}
