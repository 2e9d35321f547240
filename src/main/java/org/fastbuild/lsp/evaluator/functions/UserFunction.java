package org.fastbuild.lsp.evaluator.functions;

import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A declared user function. The body is kept unevaluated and runs on every call.
 *
 * @param name The function name.
 * @param definition The definition of the function name.
 * @param parameters The parameters in order.
 * @param statements The body.
 */
public record UserFunction(String name, VariableDefinition definition, List<Parameter> parameters, List<AstNode> statements) {

    public UserFunction {
        parameters = List.copyOf(parameters);
        statements = List.copyOf(statements);
    }

    /**
     * A parameter of a user function.
     * @param name The parameter name.
     * @param definition The definition created at the parameter's declaration.
     */
    public record Parameter(String name, VariableDefinition definition) {
    }
}
