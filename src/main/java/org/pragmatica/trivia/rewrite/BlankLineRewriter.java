package org.pragmatica.trivia.rewrite;

import com.google.common.collect.ImmutableList;
import org.pragmatica.trivia.scan.TriviaConfig;
import org.pragmatica.trivia.scan.TriviaScanner;
import org.pragmatica.trivia.tree.Token;
import org.pragmatica.trivia.tree.Trivia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.pragmatica.trivia.scan.TriviaClassifier.endsLine;
import static org.pragmatica.trivia.scan.TriviaClassifier.isEndOfLine;
import static org.pragmatica.trivia.scan.TriviaClassifier.isWhitespace;
import static org.pragmatica.trivia.scan.TriviaClassifier.isWhitespaceOrEndOfLine;

/**
 * Removes whitespace and blank lines from trivia lists and tokens.
 *
 * <p>All operations return new lists or tokens and leave their arguments untouched.
 * Directive trivia are never removed.
 */
public final class BlankLineRewriter {
    private static final Logger log = LoggerFactory.getLogger(BlankLineRewriter.class);

    private final TriviaScanner scanner;

    private BlankLineRewriter(TriviaScanner scanner) {
        this.scanner = scanner;
    }

    public static BlankLineRewriter create(TriviaConfig config) {
        return new BlankLineRewriter(TriviaScanner.create(config));
    }

    public static BlankLineRewriter create(TriviaScanner scanner) {
        return new BlankLineRewriter(checkNotNull(scanner, "scanner"));
    }

    public TriviaScanner scanner() {
        return scanner;
    }

    // === Trivia Lists ===

    /**
     * List without its trailing whitespace and blank lines; the line break ending the last content
     * line is kept. Applying this twice gives the same result as applying it once.
     */
    public ImmutableList<Trivia> withoutTrailingWhitespace(List<Trivia> trivia) {
        var start = scanner.indexOfTrailingWhitespace(trivia);

        if (start.isEmpty()) {
            return ImmutableList.copyOf(trivia);
        }
        return ImmutableList.copyOf(trivia.subList(0, start.getAsInt()));
    }

    /**
     * List starting at its first trivium that is neither whitespace nor a line break;
     * empty if there is none.
     */
    public ImmutableList<Trivia> withoutLeadingWhitespace(List<Trivia> trivia) {
        var start = scanner.indexOfFirstNonWhitespace(trivia);

        if (start.isEmpty()) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(trivia.subList(start.getAsInt(), trivia.size()));
    }

    // === Tokens ===

    /**
     * Whether blank lines precede the line of {@code token}. Indentation on the token's own line
     * is ignored. Leading trivia made of blank lines only (as at the start of a file) count as
     * blank lines.
     */
    public boolean hasLeadingBlankLines(Token token) {
        return leadingBlankLineCount(token) > 0;
    }

    /**
     * Number of blank lines between the previous content (a comment, a directive, another token
     * or the start of the file) and the line of {@code token}.
     */
    public int leadingBlankLineCount(Token token) {
        var trivia = token.leadingTrivia();
        var index = trivia.size() - 1;

        while (index >= 0 && isWhitespace(trivia.get(index))) {
            index--;
        }

        if (index < 0 || !isEndOfLine(trivia.get(index))) {
            return 0;
        }

        // the line break found above terminates the line before the token and is not blank itself
        var blankLines = -1;

        for (; index >= 0; index--) {
            var current = trivia.get(index);

            if (isWhitespace(current)) {
                continue;
            }
            if (isEndOfLine(current)) {
                blankLines++;
                continue;
            }
            if (endsLine(current, scanner.config())) {
                blankLines++;
            }
            return blankLines;
        }
        // the list starts at the beginning of a line, so its first line break ends a blank line
        return blankLines + 1;
    }

    /**
     * Token without the blank lines in front of its line. Content before the blank lines keeps
     * its own line break; a directive and everything before it are kept as they are. The
     * indentation on the token's line, its text and its trailing trivia are unchanged.
     *
     * @return a new token, or {@code token} itself when there is nothing to remove
     */
    public Token withoutLeadingBlankLines(Token token) {
        var trivia = token.leadingTrivia();
        var indentationStart = trivia.size();

        while (indentationStart > 0 && isWhitespace(trivia.get(indentationStart - 1))) {
            indentationStart--;
        }

        var blankLinesStart = blankLinesStart(trivia, indentationStart);

        if (blankLinesStart == indentationStart) {
            return token;
        }

        log.debug("Removing {} blank line trivia before {} '{}' at {}",
                  indentationStart - blankLinesStart, token.kind(), token.text(), token.span());

        var newLeadingTrivia = ImmutableList.<Trivia>builder()
                                            .addAll(trivia.subList(0, blankLinesStart))
                                            .addAll(trivia.subList(indentationStart, trivia.size()))
                                            .build();
        return token.withLeadingTrivia(newLeadingTrivia);
    }

    private int blankLinesStart(List<Trivia> trivia, int indentationStart) {
        for (int index = indentationStart - 1; index >= 0; index--) {
            var current = trivia.get(index);

            if (isWhitespaceOrEndOfLine(current)) {
                continue;
            }
            if (endsLine(current, scanner.config())) {
                return index + 1;
            }
            return endOfContentLine(trivia, index, indentationStart);
        }
        return 0;
    }

    // keep the line break that ends the content line at contentIndex
    private static int endOfContentLine(List<Trivia> trivia, int contentIndex, int limit) {
        for (int index = contentIndex + 1; index < limit; index++) {
            if (isEndOfLine(trivia.get(index))) {
                return index + 1;
            }
        }
        return limit;
    }
}
