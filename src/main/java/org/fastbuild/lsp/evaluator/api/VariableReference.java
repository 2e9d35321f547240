package org.fastbuild.lsp.evaluator.api;

import java.util.List;

/**
 * An occurrence of a variable and the definition(s) it resolves to. A variable brought into scope by
 * {@code Using} resolves to several definitions.
 *
 * @param definitions The definitions, in order of origin.
 * @param range The range of the occurrence.
 * @param type Whether the occurrence reads, writes or modifies the variable.
 */
public record VariableReference(List<VariableDefinition> definitions, SourceRange range, ReferenceType type) {

    public VariableReference {
        definitions = List.copyOf(definitions);
    }
}
