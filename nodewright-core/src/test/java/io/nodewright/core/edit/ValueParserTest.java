package io.nodewright.core.edit;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ValueParser")
class ValueParserTest {

    @Test
    @DisplayName("parses booleans and null words ignoring case")
    void shouldParseKeywords() {
        assertThat(ValueParser.parse("True")).isEqualTo(Boolean.TRUE);
        assertThat(ValueParser.parse("false")).isEqualTo(Boolean.FALSE);
        assertThat(ValueParser.parse("None")).isNull();
        assertThat(ValueParser.parse("null")).isNull();
    }

    @Test
    @DisplayName("parses numbers to the narrowest type")
    void shouldParseNumbers() {
        assertThat(ValueParser.parse("20")).isEqualTo(20);
        assertThat(ValueParser.parse("-3")).isEqualTo(-3);
        assertThat(ValueParser.parse("8000000000")).isEqualTo(8_000_000_000L);
        assertThat(ValueParser.parse("1234567890123456789012"))
                .isEqualTo(new BigInteger("1234567890123456789012"));
        assertThat(ValueParser.parse("7.5")).isEqualTo(7.5);
        assertThat(ValueParser.parse("1.0e-3")).isEqualTo(0.001);
    }

    @Test
    @DisplayName("strips matching quotes and keeps other text")
    void shouldHandleStrings() {
        assertThat(ValueParser.parse("\"a cat\"")).isEqualTo("a cat");
        assertThat(ValueParser.parse("'42'")).isEqualTo("42");
        assertThat(ValueParser.parse("euler_a")).isEqualTo("euler_a");
        assertThat(ValueParser.parse("\"open")).isEqualTo("\"open");
    }
}
