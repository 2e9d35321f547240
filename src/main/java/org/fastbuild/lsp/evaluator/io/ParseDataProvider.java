package org.fastbuild.lsp.evaluator.io;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.frontend.parser.BffParser;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses files on demand and caches the result per file, so that re-evaluating after an edit only
 * re-parses the edited file.
 */
public class ParseDataProvider {

    private final IFileSystem fileSystem;
    private final Map<Path, ParseData> cache = new HashMap<>();

    public ParseDataProvider(IFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * Returns the parsed form of a file, parsing it on first use.
     * @param path The file path.
     * @return The parse data.
     * @throws IOException if the file cannot be read.
     * @throws ParseException if the file is malformed. Failed parses are not cached.
     */
    public ParseData getParseData(Path path) throws IOException, ParseException {
        Path key = normalize(path);
        ParseData cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        return updateParseData(key);
    }

    /**
     * Re-reads and re-parses a file, replacing any cached result.
     * @param path The file path.
     * @return The new parse data.
     * @throws IOException if the file cannot be read.
     * @throws ParseException if the file is malformed. The stale entry is dropped in that case.
     */
    public ParseData updateParseData(Path path) throws IOException, ParseException {
        Path key = normalize(path);
        cache.remove(key);
        String contents = fileSystem.getFileContents(key);
        String uri = FileUris.toUri(key);
        EvaluatorLogger.debug("Parsing {}", uri);
        List<AstNode> statements = BffParser.parse(contents, uri);
        ParseData parseData = new ParseData(key, uri, statements);
        cache.put(key, parseData);
        return parseData;
    }

    /**
     * Drops the cached result of a file.
     * @param path The file path.
     */
    public void invalidate(Path path) {
        cache.remove(normalize(path));
    }

    /**
     * @return The file system this provider reads from.
     */
    public IFileSystem getFileSystem() {
        return fileSystem;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
