package org.pragmatica.trivia.error;

import org.pragmatica.trivia.tree.Token;
import org.pragmatica.trivia.tree.Trivia;

/**
 * Thrown when a caller passes arguments that contradict each other, such as a trivium
 * together with a token that does not own it. This is a programming error at the call
 * site, never a property of the source being analyzed.
 */
public final class TriviaContractException extends IllegalArgumentException {

    private TriviaContractException(String message) {
        super(message);
    }

    public static TriviaContractException notOwnedBy(Trivia trivia, Token token) {
        return new TriviaContractException("Trivia " + describe(trivia) + " at " + trivia.span()
                                           + " belongs to neither the leading nor the trailing trivia of token "
                                           + describe(token) + " at " + token.span());
    }

    public static TriviaContractException notInSequence(Token token) {
        return new TriviaContractException("Token " + describe(token) + " at " + token.span()
                                           + " is not part of the token sequence");
    }

    public static TriviaContractException noOwner(Trivia trivia) {
        return new TriviaContractException("Trivia " + describe(trivia) + " at " + trivia.span()
                                           + " is not attached to any token of the sequence");
    }

    private static String describe(Trivia trivia) {
        return trivia.getClass().getSimpleName() + "('" + escape(trivia.text()) + "')";
    }

    private static String describe(Token token) {
        return token.kind() + "('" + escape(token.text()) + "')";
    }

    private static String escape(String text) {
        return text.replace("\r", "\\r")
                   .replace("\n", "\\n")
                   .replace("\t", "\\t");
    }
}
