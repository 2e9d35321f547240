package org.fastbuild.lsp.evaluator.frontend.parser;

/**
 * Helpers for the raw contents of BFF string literals.
 */
public final class StringContents {

    /** The escape character: the character after it is taken literally. */
    public static final char ESCAPE = '^';

    private StringContents() {}

    /**
     * Resolves {@code ^} escapes.
     * @param raw The contents between the quotes.
     * @return The string value.
     */
    public static String unescape(String raw) {
        StringBuilder result = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ESCAPE && i + 1 < raw.length()) {
                result.append(raw.charAt(++i));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
