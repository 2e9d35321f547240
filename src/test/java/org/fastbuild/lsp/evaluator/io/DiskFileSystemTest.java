package org.fastbuild.lsp.evaluator.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiskFileSystemTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Reads saved files from disk")
    void readsFromDisk() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fbuild.bff"), ".A = 1");
        DiskFileSystem fileSystem = new DiskFileSystem();

        assertThat(fileSystem.getFileContents(file)).isEqualTo(".A = 1");
        assertThat(fileSystem.fileExists(file)).isTrue();
        assertThat(fileSystem.fileExists(tempDir)).isFalse();
    }

    @Test
    @DisplayName("Open documents take precedence until closed")
    void openDocumentsOverlayDisk() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fbuild.bff"), ".A = 1");
        DiskFileSystem fileSystem = new DiskFileSystem();

        fileSystem.setDocument(file, ".A = 2");
        assertThat(fileSystem.getFileContents(tempDir.resolve("sub/../fbuild.bff"))).isEqualTo(".A = 2");

        fileSystem.closeDocument(file);
        assertThat(fileSystem.getFileContents(file)).isEqualTo(".A = 1");
    }

    @Test
    @DisplayName("An unsaved document exists even if the file does not")
    void unsavedDocumentExists() throws IOException {
        Path file = tempDir.resolve("new.bff");
        DiskFileSystem fileSystem = new DiskFileSystem();

        assertThat(fileSystem.fileExists(file)).isFalse();
        assertThatThrownBy(() -> fileSystem.getFileContents(file)).isInstanceOf(NoSuchFileException.class);

        fileSystem.setDocument(file, "");
        assertThat(fileSystem.fileExists(file)).isTrue();
        assertThat(fileSystem.getFileContents(file)).isEmpty();
    }
}
