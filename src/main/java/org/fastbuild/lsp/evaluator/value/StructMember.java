package org.fastbuild.lsp.evaluator.value;

import org.fastbuild.lsp.evaluator.api.VariableDefinition;

import java.util.List;

/**
 * A member of a struct value.
 *
 * @param value The member value.
 * @param definitions The definitions that own the member. A member that travelled through one or more
 *                    {@code Using} statements is owned by each variable it passed through.
 */
public record StructMember(Value value, List<VariableDefinition> definitions) {

    public StructMember {
        definitions = List.copyOf(definitions);
    }
}
