package org.pragmatica.trivia.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.trivia.error.TriviaContractException;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable, ordered sequence of the tokens of one source file.
 *
 * <p>Concatenating {@link Token#toFullString()} of every token in order reproduces the source
 * text. Token and trivia lookups compare by reference: a sequence may contain equal tokens
 * (two {@code ;} with the same trivia), and only the instance tells them apart.
 */
public final class TokenSequence {
    private final ImmutableList<Token> tokens;

    private TokenSequence(ImmutableList<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenSequence of(List<Token> tokens) {
        return new TokenSequence(ImmutableList.copyOf(tokens));
    }

    public static TokenSequence of(Token... tokens) {
        return new TokenSequence(ImmutableList.copyOf(tokens));
    }

    public ImmutableList<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public OptionalInt indexOf(Token token) {
        checkNotNull(token, "token");
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i) == token) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean contains(Token token) {
        return indexOf(token).isPresent();
    }

    /**
     * Token following {@code token}, or empty for the last token.
     *
     * @throws TriviaContractException if {@code token} is not part of this sequence
     */
    public Optional<Token> next(Token token) {
        var index = requireIndex(token);
        return index + 1 < tokens.size() ? Optional.of(tokens.get(index + 1)) : Optional.empty();
    }

    /**
     * Token preceding {@code token}, or empty for the first token.
     *
     * @throws TriviaContractException if {@code token} is not part of this sequence
     */
    public Optional<Token> previous(Token token) {
        var index = requireIndex(token);
        return index > 0 ? Optional.of(tokens.get(index - 1)) : Optional.empty();
    }

    /**
     * Token whose leading or trailing trivia hold this very trivia instance.
     */
    public Optional<Token> ownerOf(Trivia trivia) {
        checkNotNull(trivia, "trivia");
        for (var token : tokens) {
            if (containsInstance(token.leadingTrivia(), trivia) || containsInstance(token.trailingTrivia(), trivia)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * New sequence with {@code original} substituted by {@code replacement}. This sequence is not changed.
     *
     * @throws TriviaContractException if {@code original} is not part of this sequence
     */
    public TokenSequence replace(Token original, Token replacement) {
        checkNotNull(replacement, "replacement");
        var index = requireIndex(original);
        var builder = ImmutableList.<Token>builderWithExpectedSize(tokens.size());

        builder.addAll(tokens.subList(0, index));
        builder.add(replacement);
        builder.addAll(tokens.subList(index + 1, tokens.size()));
        return new TokenSequence(builder.build());
    }

    /**
     * Source text covered by the sequence, trivia included.
     */
    public String toSource() {
        var builder = new StringBuilder();
        tokens.forEach(token -> builder.append(token.toFullString()));
        return builder.toString();
    }

    private int requireIndex(Token token) {
        return indexOf(token).orElseThrow(() -> TriviaContractException.notInSequence(token));
    }

    private static boolean containsInstance(List<Trivia> list, Trivia trivia) {
        return indexOfInstance(list, trivia).isPresent();
    }

    /**
     * Position of this very trivia instance in {@code list}.
     */
    public static OptionalInt indexOfInstance(List<Trivia> list, Trivia trivia) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == trivia) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "TokenSequence" + tokens;
    }
}
