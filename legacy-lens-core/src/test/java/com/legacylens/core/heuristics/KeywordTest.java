package com.legacylens.core.heuristics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Keyword} token matching.
 */
class KeywordTest {

    @ParameterizedTest
    @CsvSource({
        "IF, '           IF WS-A > 0', 1",
        "IF, '           END-IF', 0",
        "IF, '           if ws-a > 0 if ws-b = 1', 2",
        "IF, '       01 WS-IFLAG PIC X.', 0",
        "SORT, '           SORT-FILE', 0",
        "GO_TO, '           GO   TO EXIT-PARA', 1",
        "END_IF, '           END-IF.', 1",
        "EXEC_SQL, '           EXEC SQL SELECT 1 END-EXEC', 1"
    })
    void countIn_matchesWholeTokensOnly(Keyword keyword, String text, int expected) {
        assertThat(keyword.countIn(text)).isEqualTo(expected);
    }

    @Test
    void occursIn_multiWordKeyword_spansLineBreaks() {
        assertThat(Keyword.SEARCH_ALL.occursIn("SEARCH\n           ALL TABLE-X")).isTrue();
        assertThat(Keyword.SEARCH_ALL.occursIn("SEARCH TABLE-X")).isFalse();
    }

    @Test
    void text_returnsKeywordAsWritten() {
        assertThat(Keyword.PROCEDURE_DIVISION.text()).isEqualTo("PROCEDURE DIVISION");
    }
}
