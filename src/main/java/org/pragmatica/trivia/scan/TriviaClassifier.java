package org.pragmatica.trivia.scan;

import org.pragmatica.trivia.tree.Trivia;

/**
 * Predicates over trivia kinds.
 */
public final class TriviaClassifier {
    private TriviaClassifier() {}

    public static boolean isWhitespace(Trivia trivia) {
        return trivia instanceof Trivia.Whitespace;
    }

    public static boolean isEndOfLine(Trivia trivia) {
        return trivia instanceof Trivia.EndOfLine;
    }

    public static boolean isWhitespaceOrEndOfLine(Trivia trivia) {
        return isWhitespace(trivia) || isEndOfLine(trivia);
    }

    /**
     * True for {@code if}, {@code elif}, {@code else} and {@code endif} directives.
     */
    public static boolean isDirective(Trivia trivia) {
        return trivia instanceof Trivia.Directive;
    }

    public static boolean isComment(Trivia trivia) {
        return trivia instanceof Trivia.LineComment || trivia instanceof Trivia.BlockComment;
    }

    /**
     * True when {@code trivia} terminates a line without a separate {@link Trivia.EndOfLine}.
     */
    public static boolean endsLine(Trivia trivia, TriviaConfig config) {
        return config.directiveEndsLine() && isDirective(trivia);
    }
}
