package org.pragmatica.trivia.tree;

/**
 * Trivia represents non-semantic content between tokens: whitespace, line breaks, comments
 * and conditional-compilation directives.
 *
 * <p>Trivia are compared by value like any record, but a trivia list may hold several equal
 * trivia (two single spaces created by a rewrite, for instance). Code that has to find one
 * particular trivium in a list therefore searches by reference, see {@link TokenSequence#ownerOf(Trivia)}.
 */
public sealed interface Trivia {
    SourceSpan span();

    String text();

    /**
     * Spaces and tabs, never a line break.
     */
    record Whitespace(SourceSpan span, String text) implements Trivia {}

    /**
     * A single line terminator ({@code "\n"} or {@code "\r\n"}).
     */
    record EndOfLine(SourceSpan span, String text) implements Trivia {}

    record LineComment(SourceSpan span, String text) implements Trivia {}

    record BlockComment(SourceSpan span, String text) implements Trivia {}

    /**
     * Conditional-compilation directive line. The text includes the line terminator,
     * so no {@link EndOfLine} follows a directive that ends its own line.
     */
    record Directive(SourceSpan span, String text, Kind kind) implements Trivia {
        public enum Kind {
            IF,
            ELIF,
            ELSE,
            END_IF
        }
    }

    /**
     * Any other trivia: region and pragma markers, documentation, skipped text.
     */
    record Other(SourceSpan span, String text) implements Trivia {}

    static Whitespace whitespace(String text) {
        return new Whitespace(SourceSpan.DETACHED, text);
    }

    static EndOfLine endOfLine() {
        return new EndOfLine(SourceSpan.DETACHED, "\n");
    }

    static LineComment lineComment(String text) {
        return new LineComment(SourceSpan.DETACHED, text);
    }

    static BlockComment blockComment(String text) {
        return new BlockComment(SourceSpan.DETACHED, text);
    }

    static Directive directive(Directive.Kind kind, String text) {
        return new Directive(SourceSpan.DETACHED, text, kind);
    }

    static Other other(String text) {
        return new Other(SourceSpan.DETACHED, text);
    }
}
