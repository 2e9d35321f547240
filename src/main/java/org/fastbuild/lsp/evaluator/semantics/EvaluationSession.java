package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.EvaluatorSettings;
import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.functions.TargetRegistry;
import org.fastbuild.lsp.evaluator.functions.UserFunctionRegistry;
import org.fastbuild.lsp.evaluator.io.IFileSystem;
import org.fastbuild.lsp.evaluator.io.ParseDataProvider;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.value.Value;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All mutable state of one evaluation pass: the scope chain with its id counter, the recorded data,
 * the function and target registries, the {@code #once} set and the chain of files being included.
 * Nothing is shared between sessions.
 */
public class EvaluationSession {

    public static final String WORKING_DIR_VARIABLE = "_WORKING_DIR_";
    public static final String CURRENT_BFF_DIR_VARIABLE = "_CURRENT_BFF_DIR_";
    public static final String FASTBUILD_VERSION_STRING_VARIABLE = "_FASTBUILD_VERSION_STRING_";
    public static final String FASTBUILD_VERSION_VARIABLE = "_FASTBUILD_VERSION_";
    public static final String FASTBUILD_EXE_PATH_VARIABLE = "_FASTBUILD_EXE_PATH_";

    /** The id of the definitions of built-in variables, which have no source location. */
    public static final int BUILT_IN_DEFINITION_ID = -1;

    private final EvaluatorSettings settings;
    private final ParseDataProvider parseDataProvider;
    private final Map<String, String> environment;
    private final Path rootDirectory;
    private final ScopeStack scopeStack = new ScopeStack();
    private final EvaluatedData data = new EvaluatedData();
    private final UserFunctionRegistry userFunctions = new UserFunctionRegistry();
    private final TargetRegistry targets = new TargetRegistry();
    private final Set<Path> onceIncludedFiles = new HashSet<>();
    private final Deque<Path> activeFiles = new ArrayDeque<>();
    private final ScopeVariable currentBffDirVariable;

    /**
     * Creates a session and binds the built-in variables in the root scope.
     * @param settings The evaluator settings.
     * @param parseDataProvider The source of parsed files.
     * @param environment The environment variables visible to {@code exists()} and {@code #import}.
     * @param rootFile The root BFF file.
     */
    public EvaluationSession(EvaluatorSettings settings, ParseDataProvider parseDataProvider,
                             Map<String, String> environment, Path rootFile) {
        this.settings = settings;
        this.parseDataProvider = parseDataProvider;
        this.environment = Map.copyOf(environment);
        this.rootDirectory = rootFile.toAbsolutePath().normalize().getParent();
        activeFiles.push(rootFile.toAbsolutePath().normalize());

        bindBuiltIn(WORKING_DIR_VARIABLE, new Value.Str(rootDirectory.toString()));
        this.currentBffDirVariable = bindBuiltIn(CURRENT_BFF_DIR_VARIABLE, new Value.Str(""));
        bindBuiltIn(FASTBUILD_VERSION_STRING_VARIABLE, new Value.Str("vPlaceholderFastBuildVersionString"));
        bindBuiltIn(FASTBUILD_VERSION_VARIABLE, new Value.Int(-1));
        bindBuiltIn(FASTBUILD_EXE_PATH_VARIABLE, new Value.Str("placeholder-path-to-fastbuild-exe"));
    }

    private ScopeVariable bindBuiltIn(String name, Value value) {
        VariableDefinition definition = new VariableDefinition(BUILT_IN_DEFINITION_ID, SourceRange.empty(), name);
        return scopeStack.setInCurrentScope(name, value, List.of(definition));
    }

    public EvaluatorSettings getSettings() {
        return settings;
    }

    public ParseDataProvider getParseDataProvider() {
        return parseDataProvider;
    }

    public IFileSystem getFileSystem() {
        return parseDataProvider.getFileSystem();
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    /**
     * @return The absolute directory of the root file.
     */
    public Path getRootDirectory() {
        return rootDirectory;
    }

    public ScopeStack getScopeStack() {
        return scopeStack;
    }

    public EvaluatedData getData() {
        return data;
    }

    public UserFunctionRegistry getUserFunctions() {
        return userFunctions;
    }

    public TargetRegistry getTargets() {
        return targets;
    }

    /**
     * The root-scope binding of {@value #CURRENT_BFF_DIR_VARIABLE}, updated around every include.
     * Held directly because a function body cannot see the root scope.
     * @return The binding.
     */
    public ScopeVariable getCurrentBffDirVariable() {
        return currentBffDirVariable;
    }

    /**
     * Marks a file so that later includes of it are skipped.
     * @param file The file containing {@code #once}.
     */
    public void markIncludedOnce(Path file) {
        onceIncludedFiles.add(file.toAbsolutePath().normalize());
    }

    public boolean isIncludedOnce(Path file) {
        return onceIncludedFiles.contains(file.toAbsolutePath().normalize());
    }

    /**
     * Records that the statements of {@code file} are about to run on behalf of an {@code #include}.
     * @param file The included file.
     * @return {@code false} if the file is already running further up the include chain.
     */
    public boolean enterFile(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (activeFiles.contains(normalized)) {
            return false;
        }
        activeFiles.push(normalized);
        return true;
    }

    public void exitFile() {
        activeFiles.pop();
    }
}
