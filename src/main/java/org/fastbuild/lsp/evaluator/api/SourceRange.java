package org.fastbuild.lsp.evaluator.api;

/**
 * An immutable span of source text. The end position is exclusive.
 *
 * @param uri The uri of the file the range belongs to.
 * @param start The first position of the range.
 * @param end The position just after the last character of the range.
 */
public record SourceRange(String uri, SourcePosition start, SourcePosition end) {

    private static final SourceRange EMPTY = new SourceRange("", new SourcePosition(-1, -1), new SourcePosition(-1, -1));

    /**
     * Creates a range from raw line/character values.
     * @param uri The file uri.
     * @param startLine The 0-based start line.
     * @param startCharacter The 0-based start character.
     * @param endLine The 0-based end line.
     * @param endCharacter The 0-based, exclusive end character.
     * @return The new range.
     */
    public static SourceRange of(String uri, int startLine, int startCharacter, int endLine, int endCharacter) {
        return new SourceRange(uri, new SourcePosition(startLine, startCharacter), new SourcePosition(endLine, endCharacter));
    }

    /**
     * Creates a range that runs from the start of {@code first} to the end of {@code last}.
     * @param first The range supplying the start.
     * @param last The range supplying the end.
     * @return The spanning range, in the file of {@code first}.
     */
    public static SourceRange between(SourceRange first, SourceRange last) {
        return new SourceRange(first.uri(), first.start(), last.end());
    }

    /**
     * Returns the range used for things without a source location, such as built-in variables.
     * @return The empty range.
     */
    public static SourceRange empty() {
        return EMPTY;
    }

    /**
     * Checks whether a position lies within this range. Both ends are treated as inclusive so that a
     * cursor placed directly after a token still hits it.
     * @param position The position to check.
     * @return true if the position is within the range.
     */
    public boolean contains(SourcePosition position) {
        return start.compareTo(position) <= 0 && position.compareTo(end) <= 0;
    }

    @Override
    public String toString() {
        return uri + "[" + start + "-" + end + "]";
    }
}
