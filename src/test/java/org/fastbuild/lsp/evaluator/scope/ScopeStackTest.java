package org.fastbuild.lsp.evaluator.scope;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScopeStackTest {

    private static final SourceRange RANGE = SourceRange.of("file:///fbuild.bff", 0, 0, 0, 2);

    private ScopeStack scopes;

    @BeforeEach
    void setUp() {
        scopes = new ScopeStack();
    }

    private ScopeVariable bind(String name, Value value) {
        VariableDefinition definition = scopes.createVariableDefinition(RANGE, name);
        return scopes.setInCurrentScope(name, value, List.of(definition));
    }

    @Test
    @DisplayName("Inner bindings shadow outer ones and disappear with their scope")
    void shadowing() throws EvaluationException {
        bind("A", new Value.Int(1));
        scopes.enterScope();
        bind("A", new Value.Int(2));

        assertThat(scopes.getStartingFromCurrentScope("A", RANGE).getValue()).isEqualTo(new Value.Int(2));
        assertThat(scopes.getStartingFromParentScope("A", RANGE).getValue()).isEqualTo(new Value.Int(1));

        scopes.leaveScope();
        assertThat(scopes.getStartingFromCurrentScope("A", RANGE).getValue()).isEqualTo(new Value.Int(1));
    }

    @Test
    @DisplayName("A private scope hides everything above it")
    void privateScope() {
        bind("Outer", new Value.Bool(true));
        scopes.enterPrivateScope();

        assertThat(scopes.findStartingFromCurrentScope("Outer")).isEmpty();
        assertThatThrownBy(() -> scopes.getStartingFromParentScope("Outer", RANGE))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Referencing variable \"Outer\" in a parent scope that is not defined in any parent scope.");

        scopes.enterScope();
        bind("Inner", new Value.Int(1));
        scopes.enterScope();
        assertThat(scopes.findStartingFromCurrentScope("Inner")).isPresent();
        assertThat(scopes.findStartingFromCurrentScope("Outer")).isEmpty();
    }

    @Test
    @DisplayName("The root scope has no parent")
    void rootHasNoParent() {
        assertThatThrownBy(() -> scopes.getStartingFromParentScope("A", RANGE))
                .hasMessage("Cannot access parent scope because there is no parent scope.");
    }

    @Test
    @DisplayName("Modification targets only the current scope unless the parent is named")
    void modificationLookup() throws EvaluationException {
        bind("A", new Value.Int(1));
        scopes.enterScope();

        assertThatThrownBy(() -> scopes.getForModification(ScopeLocation.CURRENT, "A", RANGE))
                .hasMessage("Referencing variable \"A\" that is not defined in the current scope.");
        assertThat(scopes.getForModification(ScopeLocation.PARENT, "A", RANGE).getValue()).isEqualTo(new Value.Int(1));
    }

    @Test
    @DisplayName("Rebinding keeps the original definitions")
    void rebindingKeepsDefinitions() {
        ScopeVariable first = bind("A", new Value.Int(1));
        ScopeVariable second = scopes.setInCurrentScope("A", new Value.Int(2), List.of());

        assertThat(second).isSameAs(first);
        assertThat(second.getValue()).isEqualTo(new Value.Int(2));
        assertThat(second.getDefinitions()).extracting(VariableDefinition::name).containsExactly("A");
    }

    @Test
    @DisplayName("Depth counts the root scope and never drops below it")
    void depth() {
        assertThat(scopes.getDepth()).isEqualTo(1);
        scopes.enterScope();
        scopes.enterPrivateScope();
        assertThat(scopes.getDepth()).isEqualTo(3);

        scopes.leaveScope();
        scopes.leaveScope();
        scopes.leaveScope();
        assertThat(scopes.getDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Variable and target definitions share one id sequence")
    void sharedIds() {
        VariableDefinition variable = scopes.createVariableDefinition(RANGE, "A");
        int targetId = scopes.createTargetDefinition(RANGE, "app").id();
        VariableDefinition next = scopes.createVariableDefinition(RANGE, "B");

        assertThat(variable.id()).isEqualTo(1);
        assertThat(targetId).isEqualTo(2);
        assertThat(next.id()).isEqualTo(3);
    }
}
