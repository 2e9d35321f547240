package org.fastbuild.lsp.evaluator.io;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * An {@link IFileSystem} backed by a map, for tests that must not touch the disk.
 */
public class InMemoryFileSystem implements IFileSystem {

    private final Map<Path, String> files = new HashMap<>();

    /**
     * Adds or replaces a file.
     * @param path The file path.
     * @param contents The file contents.
     * @return this, for chaining.
     */
    public InMemoryFileSystem withFile(Path path, String contents) {
        files.put(normalize(path), contents);
        return this;
    }

    @Override
    public String getFileContents(Path path) throws IOException {
        String contents = files.get(normalize(path));
        if (contents == null) {
            throw new NoSuchFileException(path.toString());
        }
        return contents;
    }

    @Override
    public boolean fileExists(Path path) {
        return files.containsKey(normalize(path));
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
