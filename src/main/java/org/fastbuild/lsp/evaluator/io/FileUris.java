package org.fastbuild.lsp.evaluator.io;

import java.nio.file.Path;

/**
 * Conversion between file paths and the uris used in source ranges.
 */
public final class FileUris {

    private FileUris() {}

    /**
     * @param path A file path.
     * @return The {@code file:} uri of the normalized absolute path.
     */
    public static String toUri(Path path) {
        return path.toAbsolutePath().normalize().toUri().toString();
    }
}
