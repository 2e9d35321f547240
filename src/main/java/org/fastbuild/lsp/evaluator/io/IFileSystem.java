package org.fastbuild.lsp.evaluator.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Read access to BFF files. Abstracted so that an editor can serve unsaved buffers and tests can
 * serve in-memory files.
 */
public interface IFileSystem {

    /**
     * Reads a file.
     * @param path The absolute path.
     * @return The file contents.
     * @throws IOException if the file cannot be read.
     */
    String getFileContents(Path path) throws IOException;

    /**
     * @param path The absolute path.
     * @return true if the path exists and is a regular file.
     */
    boolean fileExists(Path path);
}
