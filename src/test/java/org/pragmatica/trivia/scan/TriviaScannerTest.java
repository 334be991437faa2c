package org.pragmatica.trivia.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.trivia.TriviaFixtures.trivia;

/**
 * Index queries of {@link TriviaScanner}. In the tables an index of -1 means "no index".
 */
class TriviaScannerTest {

    private final TriviaScanner scanner = TriviaScanner.create(TriviaConfig.DEFAULT);

    // === First Non-Whitespace ===

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource({
        "'',                 -1",
        "ws,                 -1",
        "eol,                -1",
        "ws eol eol,         -1",
        "comment,            0",
        "block ws,           0",
        "ws other,           1",
        "ws eol comment ws,  2",
        "eol if eol ws,      1",
        "eol ws eol endif,   3"
    })
    void firstNonWhitespace(String notation, int expected) {
        assertThat(scanner.indexOfFirstNonWhitespace(trivia(notation))).isEqualTo(index(expected));
    }

    // === First Non-Blank Line ===

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource({
        "'',                      -1",
        "ws,                      0",
        "eol,                     -1",
        "ws eol,                  -1",
        "eol eol,                 -1",
        "eol eol ws,              2",
        "ws eol eol ws,           3",
        "comment eol ws,          0",
        "ws comment,              0",
        "eol ws comment,          1",
        "eol eol ws comment eol,  2",
        "eol if eol ws,           1",
        "eol eol else,            2"
    })
    void firstNonBlankLine(String notation, int expected) {
        assertThat(scanner.indexOfFirstNonBlankLine(trivia(notation))).isEqualTo(index(expected));
    }

    @Test
    void firstNonBlankLine_twoBlankLinesThenIndentation_startsAtIndentation() {
        var list = trivia("ws eol eol ws");

        var index = scanner.indexOfFirstNonBlankLine(list);

        assertThat(index).hasValue(3);
        assertThat(scanner.indexOfFirstNonWhitespace(list)).isEmpty();
    }

    // === Trailing Whitespace ===

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource({
        "'',                  -1",
        "comment,             -1",
        "other eol,           -1",
        "comment eol,         -1",
        "comment ws,          1",
        "comment ws eol,      1",
        "comment eol ws,      2",
        "comment eol eol ws,  2",
        "block eol ws eol,    2",
        "ws,                  0",
        "eol eol,             0",
        "ws eol ws,           0",
        "if,                  -1",
        "if endif,            -1",
        "if ws,               1",
        "if eol,              1",
        "endif eol ws,        1",
        "comment if eol,      2",
        "if endif eol,        2",
        "else eol eol,        1"
    })
    void trailingWhitespace(String notation, int expected) {
        assertThat(scanner.indexOfTrailingWhitespace(trivia(notation))).isEqualTo(index(expected));
    }

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource({
        "if eol,          -1",
        "endif eol ws,    2",
        "if ws,           1",
        "comment if eol,  -1"
    })
    void trailingWhitespace_directiveWithoutEmbeddedLineBreak_keepsItsLineBreak(String notation, int expected) {
        var plain = TriviaScanner.create(new TriviaConfig(false));

        assertThat(plain.indexOfTrailingWhitespace(trivia(notation))).isEqualTo(index(expected));
    }

    @Test
    void trailingWhitespace_commentWhitespaceLineBreak_commentRetained() {
        var list = trivia("comment ws eol");

        assertThat(scanner.indexOfTrailingWhitespace(list)).hasValue(1);
    }

    private static OptionalInt index(int value) {
        return value < 0 ? OptionalInt.empty() : OptionalInt.of(value);
    }
}
