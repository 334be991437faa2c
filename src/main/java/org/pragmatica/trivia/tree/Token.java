package org.pragmatica.trivia.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lexical unit with the trivia attached before and after it.
 *
 * <p>Trailing trivia run from the end of the token text up to and including the line break
 * that ends the token's line. Everything after that line break belongs to the leading trivia
 * of the next token. Tokens are immutable: the {@code with*} methods return new tokens.
 *
 * @param span           Source span of the token text (excluding trivia)
 * @param kind           Lexical kind, e.g. "identifier" or "eof"
 * @param text           Token text
 * @param leadingTrivia  Trivia before the token text
 * @param trailingTrivia Trivia after the token text
 */
public record Token(
    SourceSpan span,
    String kind,
    String text,
    ImmutableList<Trivia> leadingTrivia,
    ImmutableList<Trivia> trailingTrivia) {

    public Token {
        checkNotNull(span, "span");
        checkNotNull(kind, "kind");
        checkNotNull(text, "text");
        checkNotNull(leadingTrivia, "leadingTrivia");
        checkNotNull(trailingTrivia, "trailingTrivia");
    }

    public static Token token(String kind, String text, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
        return new Token(SourceSpan.DETACHED,
                         kind,
                         text,
                         ImmutableList.copyOf(leadingTrivia),
                         ImmutableList.copyOf(trailingTrivia));
    }

    public boolean hasLeadingTrivia() {
        return !leadingTrivia.isEmpty();
    }

    public boolean hasTrailingTrivia() {
        return !trailingTrivia.isEmpty();
    }

    public Token withLeadingTrivia(List<Trivia> trivia) {
        return new Token(span, kind, text, ImmutableList.copyOf(trivia), trailingTrivia);
    }

    public Token withTrailingTrivia(List<Trivia> trivia) {
        return new Token(span, kind, text, leadingTrivia, ImmutableList.copyOf(trivia));
    }

    /**
     * Token text surrounded by the text of its leading and trailing trivia.
     */
    public String toFullString() {
        var builder = new StringBuilder();
        leadingTrivia.forEach(trivia -> builder.append(trivia.text()));
        builder.append(text);
        trailingTrivia.forEach(trivia -> builder.append(trivia.text()));
        return builder.toString();
    }
}
