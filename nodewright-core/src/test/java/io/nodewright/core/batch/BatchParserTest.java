package io.nodewright.core.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nodewright.core.exception.BatchScriptException;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BatchParser")
class BatchParserTest {

    @Test
    @DisplayName("skips comments and blank lines but keeps line numbers")
    void shouldKeepLineNumbers() throws Exception {
        List<ScriptLine> lines = BatchParser.parse("# header\n\nCOPY 2 as $x\n  wire 1:0 -> $x:0\n");

        assertThat(lines).extracting(ScriptLine::number).containsExactly(3, 4);
        assertThat(lines.get(0).verb()).isEqualTo("copy");
        assertThat(lines.get(0).args()).containsExactly("2", "as", "$x");
    }

    @Test
    @DisplayName("lower-cases verbs independently of the default locale")
    void shouldLowerCaseVerbsInAnyLocale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(BatchParser.parse("DISCONNECT 4\nINLINE").get(0).verb())
                    .isEqualTo("disconnect");
            assertThat(BatchParser.parse("INLINE").get(0).verb()).isEqualTo("inline");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("keeps quoted text in one token")
    void shouldKeepQuotedTokens() throws Exception {
        ScriptLine line = BatchParser.parse("copy 7 title=\"Final upscale\" steps=30").get(0);

        assertThat(line.args()).containsExactly("7", "title=\"Final upscale\"", "steps=30");
    }

    @Test
    @DisplayName("rejects an unterminated quote with its line number")
    void shouldRejectUnterminatedQuote() {
        assertThatThrownBy(() -> BatchParser.parse("inline\nset 3 text=\"open"))
                .isInstanceOf(BatchScriptException.class)
                .hasMessageStartingWith("Line 2:")
                .satisfies(e -> assertThat(((BatchScriptException) e).getLineNumber()).isEqualTo(2));
    }
}
