package org.fastbuild.lsp.evaluator.functions;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.TargetDefinition;
import org.fastbuild.lsp.evaluator.api.TargetReference;
import org.fastbuild.lsp.evaluator.api.UnresolvedTargetReference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The targets declared during a session, by name, and the uses of target names in target-list
 * properties.
 * <p>
 * A target may be used before it is declared, so uses are collected while evaluating and resolved
 * once the session is complete.
 */
public class TargetRegistry {

    private record PendingReference(String targetName, SourceRange range) {}

    private final Map<String, TargetDefinition> targets = new HashMap<>();
    private final List<PendingReference> pendingReferences = new ArrayList<>();

    /**
     * Registers a declared target. The first declaration of a name wins.
     * @param definition The target definition.
     */
    public void register(TargetDefinition definition) {
        targets.putIfAbsent(definition.name(), definition);
    }

    public Optional<TargetDefinition> find(String name) {
        return Optional.ofNullable(targets.get(name));
    }

    /**
     * Records a use of a target name.
     * @param targetName The referenced target.
     * @param range Where the name is used.
     */
    public void addReference(String targetName, SourceRange range) {
        pendingReferences.add(new PendingReference(targetName, range));
    }

    /**
     * Resolves the collected uses against the declared targets and records them.
     * @param data The session data to append to.
     */
    public void resolveReferences(EvaluatedData data) {
        for (PendingReference reference : pendingReferences) {
            TargetDefinition definition = targets.get(reference.targetName());
            if (definition != null) {
                data.addTargetReference(new TargetReference(definition, reference.range()));
            } else {
                data.addUnresolvedTargetReference(new UnresolvedTargetReference(reference.targetName(), reference.range()));
            }
        }
        pendingReferences.clear();
    }
}
