package org.fastbuild.lsp.evaluator.api;

/**
 * A position in a source file.
 *
 * @param line The 0-based line number.
 * @param character The 0-based character offset within the line.
 */
public record SourcePosition(int line, int character) implements Comparable<SourcePosition> {

    @Override
    public int compareTo(SourcePosition other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
