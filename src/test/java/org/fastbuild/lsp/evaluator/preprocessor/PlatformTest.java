package org.fastbuild.lsp.evaluator.preprocessor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PlatformTest {

    @Test
    @DisplayName("JVM os.name values map to platforms")
    void fromOsName() {
        assertThat(Platform.fromOsName("Windows 11")).isEqualTo(Platform.WINDOWS);
        assertThat(Platform.fromOsName("Mac OS X")).isEqualTo(Platform.OSX);
        assertThat(Platform.fromOsName("Darwin")).isEqualTo(Platform.OSX);
        assertThat(Platform.fromOsName("Linux")).isEqualTo(Platform.LINUX);
    }

    @Test
    @DisplayName("Unsupported operating systems are rejected")
    void unsupportedOs() {
        assertThatThrownBy(() -> Platform.fromOsName("SunOS"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Unsupported platform 'SunOS'");
    }

    @Test
    @DisplayName("Configured names are case-insensitive")
    void fromName() {
        assertThat(Platform.fromName(" OSX ")).isEqualTo(Platform.OSX);
        assertThat(Platform.fromName("linux")).isEqualTo(Platform.LINUX);
        assertThatThrownBy(() -> Platform.fromName("macos")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Each platform has its built-in symbol")
    void symbols() {
        assertThat(Platform.WINDOWS.symbol()).isEqualTo("__WINDOWS__");
        assertThat(Platform.OSX.symbol()).isEqualTo("__OSX__");
        assertThat(Platform.LINUX.symbol()).isEqualTo("__LINUX__");
    }
}
