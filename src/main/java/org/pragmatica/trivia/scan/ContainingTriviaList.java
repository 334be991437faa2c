package org.pragmatica.trivia.scan;

import com.google.common.collect.ImmutableList;
import org.pragmatica.trivia.error.TriviaContractException;
import org.pragmatica.trivia.tree.Token;
import org.pragmatica.trivia.tree.TokenSequence;
import org.pragmatica.trivia.tree.Trivia;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * All trivia between two adjacent tokens, with the position of one trivium inside it.
 *
 * <p>The parser splits the text between two tokens into the trailing trivia of the first and
 * the leading trivia of the second. Blank-line analysis needs the whole gap, so this joins
 * both halves back together.
 *
 * @param trivia trailing trivia of the earlier token followed by leading trivia of the later one
 * @param index  position of the requested trivium in {@code trivia}
 */
public record ContainingTriviaList(ImmutableList<Trivia> trivia, int index) {

    /**
     * Builds the list containing {@code trivium}, which must be attached to {@code token}.
     * A missing neighbour at either end of the sequence contributes no trivia.
     *
     * @throws TriviaContractException if {@code token} does not own {@code trivium},
     *                                 or {@code token} is not part of {@code tokens}
     */
    public static ContainingTriviaList of(Trivia trivium, Token token, TokenSequence tokens) {
        checkNotNull(trivium, "trivium");
        checkNotNull(token, "token");
        checkNotNull(tokens, "tokens");

        var trailingIndex = TokenSequence.indexOfInstance(token.trailingTrivia(), trivium);

        if (trailingIndex.isPresent()) {
            var following = tokens.next(token)
                                  .map(Token::leadingTrivia)
                                  .orElse(ImmutableList.of());
            return new ContainingTriviaList(concat(token.trailingTrivia(), following), trailingIndex.getAsInt());
        }

        var leadingIndex = TokenSequence.indexOfInstance(token.leadingTrivia(), trivium)
                                        .orElseThrow(() -> TriviaContractException.notOwnedBy(trivium, token));
        var preceding = tokens.previous(token)
                              .map(Token::trailingTrivia)
                              .orElse(ImmutableList.of());

        return new ContainingTriviaList(concat(preceding, token.leadingTrivia()), preceding.size() + leadingIndex);
    }

    /**
     * Same as {@link #of(Trivia, Token, TokenSequence)}, locating the owning token first.
     *
     * @throws TriviaContractException if no token of {@code tokens} owns {@code trivium}
     */
    public static ContainingTriviaList of(Trivia trivium, TokenSequence tokens) {
        checkNotNull(trivium, "trivium");
        var owner = tokens.ownerOf(trivium)
                          .orElseThrow(() -> TriviaContractException.noOwner(trivium));
        return of(trivium, owner, tokens);
    }

    public Trivia trivium() {
        return trivia.get(index);
    }

    private static ImmutableList<Trivia> concat(List<Trivia> first, List<Trivia> second) {
        return ImmutableList.<Trivia>builderWithExpectedSize(first.size() + second.size())
                            .addAll(first)
                            .addAll(second)
                            .build();
    }
}
