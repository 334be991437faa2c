package org.pragmatica.trivia.scan;

import org.pragmatica.trivia.tree.Trivia;

import java.util.List;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.pragmatica.trivia.scan.TriviaClassifier.endsLine;
import static org.pragmatica.trivia.scan.TriviaClassifier.isEndOfLine;
import static org.pragmatica.trivia.scan.TriviaClassifier.isWhitespace;
import static org.pragmatica.trivia.scan.TriviaClassifier.isWhitespaceOrEndOfLine;

/**
 * Index queries over a trivia list. Every query returns either a valid index into the list
 * or an empty {@link OptionalInt}; absence is never reported as an error.
 */
public final class TriviaScanner {
    private final TriviaConfig config;

    private TriviaScanner(TriviaConfig config) {
        this.config = config;
    }

    public static TriviaScanner create(TriviaConfig config) {
        return new TriviaScanner(checkNotNull(config, "config"));
    }

    public TriviaConfig config() {
        return config;
    }

    /**
     * Index of the first trivium that is neither whitespace nor a line break.
     *
     * @return the index, or empty if the list holds only whitespace and line breaks (or nothing)
     */
    public OptionalInt indexOfFirstNonWhitespace(List<Trivia> trivia) {
        for (int index = 0; index < trivia.size(); index++) {
            if (!isWhitespaceOrEndOfLine(trivia.get(index))) {
                return OptionalInt.of(index);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Index of the first trivium that is not part of a blank line: the start of the line holding
     * the first content trivium, indentation included.
     *
     * <p>An all-whitespace list is treated as content at its very end. If that leaves nothing
     * after the last line break, the list consists of blank lines only and the result is empty.
     * Without any line break before the content the result is 0. The empty list yields empty.
     */
    public OptionalInt indexOfFirstNonBlankLine(List<Trivia> trivia) {
        if (trivia.isEmpty()) {
            return OptionalInt.empty();
        }

        var anchor = indexOfFirstNonWhitespace(trivia).orElse(trivia.size());

        for (int index = anchor - 1; index >= 0; index--) {
            if (isEndOfLine(trivia.get(index))) {
                return index == trivia.size() - 1 ? OptionalInt.empty() : OptionalInt.of(index + 1);
            }
        }
        return OptionalInt.of(0);
    }

    /**
     * Index where the trailing run of whitespace and line breaks starts.
     *
     * <p>When the run directly follows content with a line break, that line break terminates the
     * content's own line and is not part of the result. A directive carries its own terminator,
     * so a line break after it already ends a blank line and is included.
     *
     * @return the index, or empty if the list does not end in removable whitespace
     */
    public OptionalInt indexOfTrailingWhitespace(List<Trivia> trivia) {
        var start = -1;
        var previousWasEndOfLine = false;

        for (int index = trivia.size() - 1; index >= 0; index--) {
            var current = trivia.get(index);

            if (isEndOfLine(current)) {
                start = index;
                previousWasEndOfLine = true;
            } else if (isWhitespace(current)) {
                start = index;
                previousWasEndOfLine = false;
            } else {
                if (previousWasEndOfLine && !endsLine(current, config)) {
                    start++;
                }
                break;
            }
        }
        return start >= 0 && start < trivia.size() ? OptionalInt.of(start) : OptionalInt.empty();
    }
}
