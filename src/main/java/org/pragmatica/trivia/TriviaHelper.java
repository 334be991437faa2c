package org.pragmatica.trivia;

import com.google.common.collect.ImmutableList;
import org.pragmatica.trivia.rewrite.BlankLineRewriter;
import org.pragmatica.trivia.scan.ContainingTriviaList;
import org.pragmatica.trivia.scan.TriviaConfig;
import org.pragmatica.trivia.scan.TriviaScanner;
import org.pragmatica.trivia.tree.Token;
import org.pragmatica.trivia.tree.TokenSequence;
import org.pragmatica.trivia.tree.Trivia;

import java.util.List;
import java.util.OptionalInt;

/**
 * Entry point for trivia queries and rewrites with the default {@link TriviaConfig}.
 *
 * <p>Example usage:
 * <pre>{@code
 * if (TriviaHelper.hasLeadingBlankLines(token)) {
 *     var fixed = tokens.replace(token, TriviaHelper.withoutLeadingBlankLines(token));
 * }
 * }</pre>
 *
 * Use {@link TriviaScanner#create(TriviaConfig)} and {@link BlankLineRewriter#create(TriviaConfig)}
 * for other configurations.
 */
public final class TriviaHelper {
    private static final TriviaScanner SCANNER = TriviaScanner.create(TriviaConfig.DEFAULT);
    private static final BlankLineRewriter REWRITER = BlankLineRewriter.create(SCANNER);

    private TriviaHelper() {}

    public static OptionalInt indexOfFirstNonWhitespaceTrivia(List<Trivia> trivia) {
        return SCANNER.indexOfFirstNonWhitespace(trivia);
    }

    public static OptionalInt indexOfFirstNonBlankLineTrivia(List<Trivia> trivia) {
        return SCANNER.indexOfFirstNonBlankLine(trivia);
    }

    public static OptionalInt indexOfTrailingWhitespace(List<Trivia> trivia) {
        return SCANNER.indexOfTrailingWhitespace(trivia);
    }

    public static ImmutableList<Trivia> withoutTrailingWhitespace(List<Trivia> trivia) {
        return REWRITER.withoutTrailingWhitespace(trivia);
    }

    public static ImmutableList<Trivia> withoutLeadingWhitespace(List<Trivia> trivia) {
        return REWRITER.withoutLeadingWhitespace(trivia);
    }

    /**
     * Joined trivia of the gap {@code trivium} lies in, see {@link ContainingTriviaList}.
     */
    public static ContainingTriviaList containingTriviaList(Trivia trivium, Token token, TokenSequence tokens) {
        return ContainingTriviaList.of(trivium, token, tokens);
    }

    public static boolean hasLeadingBlankLines(Token token) {
        return REWRITER.hasLeadingBlankLines(token);
    }

    public static int leadingBlankLineCount(Token token) {
        return REWRITER.leadingBlankLineCount(token);
    }

    public static Token withoutLeadingBlankLines(Token token) {
        return REWRITER.withoutLeadingBlankLines(token);
    }
}
