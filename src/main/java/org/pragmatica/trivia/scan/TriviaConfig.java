package org.pragmatica.trivia.scan;

/**
 * Trivia analysis options.
 *
 * @param directiveEndsLine whether a conditional directive trivium embeds its own line terminator.
 *                          When {@code false} directives count as ordinary content for line
 *                          structure. Directives are never removed either way.
 */
public record TriviaConfig(boolean directiveEndsLine) {
    public static final TriviaConfig DEFAULT = new TriviaConfig(true);
}
