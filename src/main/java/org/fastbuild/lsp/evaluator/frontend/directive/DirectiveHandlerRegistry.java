package org.fastbuild.lsp.evaluator.frontend.directive;

import org.fastbuild.lsp.evaluator.frontend.parser.features.define.DefineDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.ImportDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.UndefDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.IfDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.parser.features.include.IncludeDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.parser.features.include.OnceDirectiveHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of directive names
 * to their corresponding handlers.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new HashMap<>();

    /**
     * Registers a new directive handler.
     * @param directiveName The name of the directive without '#' (e.g., "include").
     * @param handler The handler for the directive.
     */
    public void register(String directiveName, IDirectiveHandler handler) {
        handlers.put(directiveName.toLowerCase(), handler);
    }

    /**
     * Gets the handler for a given directive name.
     * @param directiveName The name of the directive.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(String directiveName) {
        return Optional.ofNullable(handlers.get(directiveName.toLowerCase()));
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * {@code #else} and {@code #endif} have no handler; they are consumed by the {@code #if} handler.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register("include", new IncludeDirectiveHandler());
        registry.register("once", new OnceDirectiveHandler());
        registry.register("define", new DefineDirectiveHandler());
        registry.register("undef", new UndefDirectiveHandler());
        registry.register("import", new ImportDirectiveHandler());
        registry.register("if", new IfDirectiveHandler());
        return registry;
    }
}
