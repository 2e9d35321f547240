package org.fastbuild.lsp.evaluator.functions;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The user functions declared during a session, by name.
 */
public class UserFunctionRegistry {

    private static final Set<String> RESERVED_NAMES = Set.of(
            "true", "false", "in", "not", "function",
            "Using", "ForEach", "If", "Print", "Error", "Settings");

    private final Map<String, UserFunction> functions = new HashMap<>();

    /**
     * Checks whether a name is a keyword or a built-in function.
     * @param name The function name.
     * @return true if user functions cannot use the name.
     */
    public static boolean isReserved(String name) {
        return RESERVED_NAMES.contains(name) || GenericFunction.fromName(name).isPresent();
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public void register(UserFunction function) {
        functions.put(function.name(), function);
    }

    public Optional<UserFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }
}
