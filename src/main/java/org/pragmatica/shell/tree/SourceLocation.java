package org.pragmatica.shell.tree;

/**
 * A position in source text (line and column, both 1-based; offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Locate a character offset by scanning {@code source} from the beginning.
     */
    public static SourceLocation locate(String source, int offset) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, offset - lineStart + 1, offset);
    }

    /**
     * The location reached after reading {@code text} starting here.
     */
    public SourceLocation advance(String text) {
        int lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            return new SourceLocation(line, column + text.length(), offset + text.length());
        }
        int newlines = (int) text.chars()
                                 .filter(c -> c == '\n')
                                 .count();
        return new SourceLocation(line + newlines, text.length() - lastNewline, offset + text.length());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
