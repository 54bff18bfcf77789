package com.lazymc.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EscapeDecoder}.
 */
class EscapeDecoderTest {

    @Test
    @DisplayName("Should decode newline and tab escapes")
    void shouldDecodeControlCharacters() {
        assertThat(EscapeDecoder.decode("a\\nb\\tc")).isEqualTo("a\nb\tc");
        assertThat(EscapeDecoder.decode("line\\r\\n")).isEqualTo("line\r\n");
    }

    @Test
    @DisplayName("Should collapse a double backslash into one")
    void shouldDecodeBackslash() {
        assertThat(EscapeDecoder.decode("C:\\\\server")).isEqualTo("C:\\server");
    }

    @Test
    @DisplayName("Should not decode the result of a backslash escape again")
    void shouldNotDoubleDecode() {
        // three backslashes then t: the tab escape is replaced first, the remaining pair collapses last
        assertThat(EscapeDecoder.decode("\\\\\\t")).isEqualTo("\\\t");
        assertThat(EscapeDecoder.decode("\\\\\\\\")).isEqualTo("\\\\");
    }

    @Test
    @DisplayName("Should leave text without escapes untouched")
    void shouldPassThroughPlainText() {
        assertThat(EscapeDecoder.decode("§2☻ Join to start it up")).isEqualTo("§2☻ Join to start it up");
        assertThat(EscapeDecoder.decode("")).isEmpty();
        assertThat(EscapeDecoder.decode(null)).isNull();
    }
}
