package com.phillippitts.audio2video.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.singleLine(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldCollapseLineBreaks() {
        assertThat(LogSanitizer.singleLine("first line\n  second\r\nthird", 100))
                .isEqualTo("first line second third");
    }

    @Test
    void shouldMarkCutText() {
        assertThat(LogSanitizer.singleLine("abcdefghij", 8)).isEqualTo("abcde...");
        assertThat(LogSanitizer.singleLine("abcdefgh", 8)).isEqualTo("abcdefgh");
    }
}
