package org.fastbuild.lsp.evaluator.api;

import org.fastbuild.lsp.evaluator.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything an evaluation pass records, in evaluation order.
 * <p>
 * One instance is shared by the whole session (root file, includes and user-function bodies) so that
 * entries are appended exactly in the order the statements are evaluated.
 */
public class EvaluatedData {

    private final List<EvaluatedVariable> evaluatedVariables = new ArrayList<>();
    private final List<VariableDefinition> variableDefinitions = new ArrayList<>();
    private final List<VariableReference> variableReferences = new ArrayList<>();
    private final List<TargetDefinition> targetDefinitions = new ArrayList<>();
    private final List<TargetReference> targetReferences = new ArrayList<>();
    private final List<UnresolvedTargetReference> unresolvedTargetReferences = new ArrayList<>();

    /**
     * Records the value seen at a variable occurrence.
     * @param value The value.
     * @param range The occurrence.
     * @return The recorded entry, so that a continued modification can update it.
     */
    public EvaluatedVariable recordEvaluatedVariable(Value value, SourceRange range) {
        EvaluatedVariable evaluatedVariable = new EvaluatedVariable(value, range);
        evaluatedVariables.add(evaluatedVariable);
        return evaluatedVariable;
    }

    public void addVariableDefinition(VariableDefinition definition) {
        variableDefinitions.add(definition);
    }

    public void addVariableReference(VariableReference reference) {
        variableReferences.add(reference);
    }

    public void addTargetDefinition(TargetDefinition definition) {
        targetDefinitions.add(definition);
    }

    public void addTargetReference(TargetReference reference) {
        targetReferences.add(reference);
    }

    public void addUnresolvedTargetReference(UnresolvedTargetReference reference) {
        unresolvedTargetReferences.add(reference);
    }

    public List<EvaluatedVariable> getEvaluatedVariables() {
        return Collections.unmodifiableList(evaluatedVariables);
    }

    public List<VariableDefinition> getVariableDefinitions() {
        return Collections.unmodifiableList(variableDefinitions);
    }

    public List<VariableReference> getVariableReferences() {
        return Collections.unmodifiableList(variableReferences);
    }

    public List<TargetDefinition> getTargetDefinitions() {
        return Collections.unmodifiableList(targetDefinitions);
    }

    public List<TargetReference> getTargetReferences() {
        return Collections.unmodifiableList(targetReferences);
    }

    public List<UnresolvedTargetReference> getUnresolvedTargetReferences() {
        return Collections.unmodifiableList(unresolvedTargetReferences);
    }

    // Position queries used by hover and go-to-definition providers.

    /**
     * Finds the evaluated values recorded at a position. A position inside a loop body or a function
     * body yields one entry per evaluation.
     * @param uri The file uri.
     * @param position The cursor position.
     * @return The matching entries in evaluation order.
     */
    public List<EvaluatedVariable> findEvaluatedVariablesAt(String uri, SourcePosition position) {
        List<EvaluatedVariable> result = new ArrayList<>();
        for (EvaluatedVariable evaluatedVariable : evaluatedVariables) {
            if (isAt(evaluatedVariable.getRange(), uri, position)) {
                result.add(evaluatedVariable);
            }
        }
        return result;
    }

    /**
     * Finds the variable references at a position.
     * @param uri The file uri.
     * @param position The cursor position.
     * @return The matching references in evaluation order.
     */
    public List<VariableReference> findVariableReferencesAt(String uri, SourcePosition position) {
        List<VariableReference> result = new ArrayList<>();
        for (VariableReference reference : variableReferences) {
            if (isAt(reference.range(), uri, position)) {
                result.add(reference);
            }
        }
        return result;
    }

    /**
     * Finds the target references at a position.
     * @param uri The file uri.
     * @param position The cursor position.
     * @return The matching references in evaluation order.
     */
    public List<TargetReference> findTargetReferencesAt(String uri, SourcePosition position) {
        List<TargetReference> result = new ArrayList<>();
        for (TargetReference reference : targetReferences) {
            if (isAt(reference.range(), uri, position)) {
                result.add(reference);
            }
        }
        return result;
    }

    /**
     * Finds every reference that resolves to the given definition, e.g. for "find all references".
     * @param definition The definition.
     * @return The references that include the definition.
     */
    public List<VariableReference> findReferencesTo(VariableDefinition definition) {
        List<VariableReference> result = new ArrayList<>();
        for (VariableReference reference : variableReferences) {
            if (reference.definitions().contains(definition)) {
                result.add(reference);
            }
        }
        return result;
    }

    private static boolean isAt(SourceRange range, String uri, SourcePosition position) {
        return range.uri().equals(uri) && range.contains(position);
    }
}
