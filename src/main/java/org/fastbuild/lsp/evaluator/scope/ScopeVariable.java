package org.fastbuild.lsp.evaluator.scope;

import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.List;

/**
 * A binding of a name in one scope. The value changes on assignment and modification, the
 * definitions stay the ones the binding was created with.
 */
public final class ScopeVariable {

    private Value value;
    private final List<VariableDefinition> definitions;

    public ScopeVariable(Value value, List<VariableDefinition> definitions) {
        this.value = value;
        this.definitions = List.copyOf(definitions);
    }

    public Value getValue() {
        return value;
    }

    public void setValue(Value value) {
        this.value = value;
    }

    /**
     * @return The definitions that a reference to this binding resolves to.
     */
    public List<VariableDefinition> getDefinitions() {
        return definitions;
    }
}
