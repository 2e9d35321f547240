package org.fastbuild.lsp.evaluator.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link IFileSystem} over the local disk, with an overlay of open documents whose in-editor contents
 * take precedence over the saved file.
 */
public class DiskFileSystem implements IFileSystem {

    private final Map<Path, String> openDocuments = new ConcurrentHashMap<>();

    @Override
    public String getFileContents(Path path) throws IOException {
        String document = openDocuments.get(normalize(path));
        if (document != null) {
            return document;
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public boolean fileExists(Path path) {
        return openDocuments.containsKey(normalize(path)) || Files.isRegularFile(path);
    }

    /**
     * Registers or replaces the contents of an open document.
     * @param path The document path.
     * @param contents The current contents.
     */
    public void setDocument(Path path, String contents) {
        openDocuments.put(normalize(path), contents);
    }

    /**
     * Removes an open document so that the file is read from disk again.
     * @param path The document path.
     */
    public void closeDocument(Path path) {
        openDocuments.remove(normalize(path));
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
