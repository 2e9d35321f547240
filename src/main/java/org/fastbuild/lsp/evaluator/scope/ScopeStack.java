package org.fastbuild.lsp.evaluator.scope;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.TargetDefinition;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The chain of lexical scopes of an evaluation session.
 * <p>
 * Each scope holds its own table and shadows its ancestors. A private scope, used for user-function
 * bodies, ends the outward search: nothing above it is visible.
 * The stack also owns the id counter shared by variable and target definitions.
 */
public class ScopeStack {

    /**
     * A single scope.
     */
    static final class Scope {
        private final Scope parent;
        private final boolean canAccessParentScopes;
        private final Map<String, ScopeVariable> variables = new LinkedHashMap<>();

        Scope(Scope parent, boolean canAccessParentScopes) {
            this.parent = parent;
            this.canAccessParentScopes = canAccessParentScopes;
        }
    }

    private Scope currentScope;
    private int depth;
    private int nextDefinitionId = 1;

    /**
     * Creates a stack that holds only the root scope.
     */
    public ScopeStack() {
        this.currentScope = new Scope(null, true);
        this.depth = 1;
    }

    /**
     * Enters a child scope that can see its ancestors.
     */
    public void enterScope() {
        currentScope = new Scope(currentScope, true);
        depth++;
    }

    /**
     * Enters a child scope that cannot see its ancestors.
     */
    public void enterPrivateScope() {
        currentScope = new Scope(currentScope, false);
        depth++;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
            depth--;
        }
    }

    /**
     * @return The number of scopes on the stack, the root scope included.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * @return A read-only view of the bindings of the current scope, in insertion order.
     */
    public Map<String, ScopeVariable> getCurrentScopeVariables() {
        return Collections.unmodifiableMap(currentScope.variables);
    }

    /**
     * Looks up a name in the current scope only.
     * @param name The variable name.
     * @return The binding, if the current scope has one.
     */
    public Optional<ScopeVariable> findInCurrentScope(String name) {
        return Optional.ofNullable(currentScope.variables.get(name));
    }

    /**
     * Looks up a name starting at the current scope and moving outward.
     * @param name The variable name.
     * @return The innermost visible binding.
     */
    public Optional<ScopeVariable> findStartingFromCurrentScope(String name) {
        return findStartingFrom(currentScope, name);
    }

    /**
     * Resolves a {@code .Name} read.
     * @param name The variable name.
     * @param range The range of the occurrence, used for the error.
     * @return The innermost visible binding.
     * @throws EvaluationException if the name is not visible.
     */
    public ScopeVariable getStartingFromCurrentScope(String name, SourceRange range) throws EvaluationException {
        return findStartingFromCurrentScope(name).orElseThrow(() -> new EvaluationException(
                "Referencing variable \"" + name + "\" that is not defined in the current scope or any of the parent scopes.", range));
    }

    /**
     * Resolves a {@code ^Name} occurrence.
     * @param name The variable name.
     * @param range The range of the occurrence, used for the error.
     * @return The innermost binding visible from the parent scope.
     * @throws EvaluationException if there is no accessible parent scope or the name is not found.
     */
    public ScopeVariable getStartingFromParentScope(String name, SourceRange range) throws EvaluationException {
        if (currentScope.parent == null) {
            throw new EvaluationException("Cannot access parent scope because there is no parent scope.", range);
        }
        Optional<ScopeVariable> variable = currentScope.canAccessParentScopes
                ? findStartingFrom(currentScope.parent, name)
                : Optional.empty();
        return variable.orElseThrow(() -> new EvaluationException(
                "Referencing variable \"" + name + "\" in a parent scope that is not defined in any parent scope.", range));
    }

    /**
     * Resolves a variable that a {@code +}/{@code -} statement modifies.
     * @param location Where the lookup starts.
     * @param name The variable name.
     * @param range The range of the occurrence, used for the error.
     * @return The binding to modify.
     * @throws EvaluationException if the binding does not exist.
     */
    public ScopeVariable getForModification(ScopeLocation location, String name, SourceRange range) throws EvaluationException {
        if (location == ScopeLocation.PARENT) {
            return getStartingFromParentScope(name, range);
        }
        return findInCurrentScope(name).orElseThrow(() -> new EvaluationException(
                "Referencing variable \"" + name + "\" that is not defined in the current scope.", range));
    }

    /**
     * Binds a name in the current scope. An existing binding keeps its definitions and only takes the
     * new value.
     * @param name The variable name.
     * @param value The value.
     * @param definitions The definitions for a new binding.
     * @return The binding.
     */
    public ScopeVariable setInCurrentScope(String name, Value value, List<VariableDefinition> definitions) {
        ScopeVariable existing = currentScope.variables.get(name);
        if (existing != null) {
            existing.setValue(value);
            return existing;
        }
        ScopeVariable variable = new ScopeVariable(value, definitions);
        currentScope.variables.put(name, variable);
        return variable;
    }

    /**
     * Creates a variable definition with the next session id.
     * @param range The defining range.
     * @param name The variable name.
     * @return The new definition.
     */
    public VariableDefinition createVariableDefinition(SourceRange range, String name) {
        return new VariableDefinition(nextDefinitionId++, range, name);
    }

    /**
     * Creates a target definition with the next session id.
     * @param range The defining range.
     * @param name The target name.
     * @return The new definition.
     */
    public TargetDefinition createTargetDefinition(SourceRange range, String name) {
        return new TargetDefinition(nextDefinitionId++, range, name);
    }

    private static Optional<ScopeVariable> findStartingFrom(Scope scope, String name) {
        for (Scope s = scope; s != null; s = s.parent) {
            ScopeVariable variable = s.variables.get(name);
            if (variable != null) {
                return Optional.of(variable);
            }
            if (!s.canAccessParentScopes) {
                break;
            }
        }
        return Optional.empty();
    }
}
