package org.fastbuild.lsp.evaluator.api;

import org.fastbuild.lsp.evaluator.value.Value;

/**
 * The value a variable had at one textual occurrence.
 * <p>
 * The value is replaced when an unnamed {@code +}/{@code -} line continues the assignment this
 * occurrence belongs to, so that the occurrence shows the final value of the whole statement.
 */
public final class EvaluatedVariable {

    private Value value;
    private final SourceRange range;

    public EvaluatedVariable(Value value, SourceRange range) {
        this.value = value;
        this.range = range;
    }

    public Value getValue() {
        return value;
    }

    public SourceRange getRange() {
        return range;
    }

    /**
     * Replaces the recorded value.
     * @param newValue The value after a continued modification.
     */
    public void updateValue(Value newValue) {
        this.value = newValue;
    }

    @Override
    public String toString() {
        return "EvaluatedVariable[value=" + value + ", range=" + range + "]";
    }
}
