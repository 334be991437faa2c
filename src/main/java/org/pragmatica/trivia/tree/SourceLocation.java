package org.pragmatica.trivia.tree;

/**
 * A position in source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location reached after consuming {@code text} from this location.
     * A {@code '\n'} starts a new line; {@code "\r\n"} counts as one line break.
     */
    public SourceLocation advance(String text) {
        var newLine = line;
        var newColumn = column;

        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newLine++;
                newColumn = 1;
            } else if (text.charAt(i) != '\r') {
                newColumn++;
            }
        }
        return new SourceLocation(newLine, newColumn, offset + text.length());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
