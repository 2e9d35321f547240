package org.fastbuild.lsp.evaluator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fastbuild.lsp.evaluator.preprocessor.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EvaluatorSettingsTest {

    @TempDir
    Path tempDir;

    private static Config config(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    private static String quoted(Path path) {
        return "\"" + path.toString().replace("\\", "\\\\") + "\"";
    }

    @Test
    @DisplayName("Reference configuration yields the defaults")
    void referenceDefaults() {
        EvaluatorSettings settings = EvaluatorSettings.fromConfig(config("evaluator.platform = linux"));

        assertThat(settings.getRootFile()).isEmpty();
        assertThat(settings.getMaxScopeDepth()).isEqualTo(EvaluatorSettings.DEFAULT_MAX_SCOPE_DEPTH);
        assertThat(settings.isLogPerformanceMetrics()).isFalse();
        assertThat(settings.getPlatform()).isEqualTo(Platform.LINUX);
    }

    @Test
    @DisplayName("Configured values override the defaults")
    void overrides() throws IOException {
        Path root = Files.writeString(tempDir.resolve("fbuild.bff"), "");

        EvaluatorSettings settings = EvaluatorSettings.fromConfig(config(String.join("\n",
                "evaluator.root-file = " + quoted(root),
                "evaluator.max-scope-depth = 16",
                "evaluator.log-performance-metrics = true",
                "evaluator.platform = Windows")));

        assertThat(settings.getRootFile()).contains(root);
        assertThat(settings.getMaxScopeDepth()).isEqualTo(16);
        assertThat(settings.isLogPerformanceMetrics()).isTrue();
        assertThat(settings.getPlatform()).isEqualTo(Platform.WINDOWS);
    }

    @Test
    @DisplayName("Max scope depth must be positive")
    void maxScopeDepthMustBePositive() {
        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.max-scope-depth = 0")))
                .isInstanceOf(SettingsException.class)
                .hasMessage("The \"Max Scope Depth\" setting must be at least 1, but is 0.");
    }

    @Test
    @DisplayName("Root file must be an absolute path")
    void rootFileMustBeAbsolute() {
        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.root-file = \"relative/fbuild.bff\"")))
                .isInstanceOf(SettingsException.class)
                .hasMessage("The \"Root File\" setting is set to \"relative/fbuild.bff\", which is not an absolute file path.");
    }

    @Test
    @DisplayName("Root file must exist")
    void rootFileMustExist() {
        Path missing = tempDir.resolve("missing.bff");

        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.root-file = " + quoted(missing))))
                .isInstanceOf(SettingsException.class)
                .hasMessageEndingWith("which does not exist.");
    }

    @Test
    @DisplayName("Root file must not be a directory")
    void rootFileMustBeFile() {
        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.root-file = " + quoted(tempDir))))
                .isInstanceOf(SettingsException.class)
                .hasMessageEndingWith("which is not a file.");
    }

    @Test
    @DisplayName("Keys the evaluator does not read are ignored")
    void unknownKeysAreIgnored() {
        EvaluatorSettings settings = EvaluatorSettings.fromConfig(config(String.join("\n",
                "evaluator.platform = linux",
                "evaluator.input-debounce-delay = -1s")));

        assertThat(settings.getMaxScopeDepth()).isEqualTo(EvaluatorSettings.DEFAULT_MAX_SCOPE_DEPTH);
    }

    @Test
    @DisplayName("Unknown platform names are rejected")
    void unknownPlatform() {
        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.platform = beos")))
                .isInstanceOf(SettingsException.class)
                .hasMessage("The \"Platform\" setting is set to \"beos\", which is not one of windows, osx or linux.");
    }

    @Test
    @DisplayName("Values of the wrong type are reported as settings errors")
    void wrongType() {
        assertThatThrownBy(() -> EvaluatorSettings.fromConfig(config("evaluator.max-scope-depth = lots")))
                .isInstanceOf(SettingsException.class)
                .hasMessageStartingWith("Invalid evaluator configuration: ");
    }
}
