package org.fastbuild.lsp.evaluator.preprocessor;

import java.util.Locale;

/**
 * The host platforms FASTBuild supports, each with its built-in preprocessor symbol.
 */
public enum Platform {
    WINDOWS("__WINDOWS__"),
    OSX("__OSX__"),
    LINUX("__LINUX__");

    private final String symbol;

    Platform(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The symbol that is always defined on this platform.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Maps a JVM {@code os.name} value to a platform.
     * @param osName The operating system name.
     * @return The platform.
     * @throws IllegalStateException if FASTBuild does not support the operating system.
     */
    public static Platform fromOsName(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return WINDOWS;
        }
        if (name.startsWith("mac") || name.contains("darwin")) {
            return OSX;
        }
        if (name.startsWith("linux")) {
            return LINUX;
        }
        throw new IllegalStateException("Unsupported platform '" + osName + "'");
    }

    /**
     * @return The platform of the running JVM.
     */
    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    /**
     * Parses a configured platform name.
     * @param name "windows", "osx" or "linux", case-insensitive.
     * @return The platform.
     * @throws IllegalArgumentException for any other name.
     */
    public static Platform fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
