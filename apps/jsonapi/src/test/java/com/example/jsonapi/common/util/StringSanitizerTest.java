package com.example.jsonapi.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringSanitizerTest {

    @Test
    void forLog_dropsControlCharactersAndTruncates() {
        assertThat(StringSanitizer.forLog("a\nb\rc\td\u0000e")).isEqualTo("abcde");
        assertThat(StringSanitizer.forLog("abcdef", 3)).isEqualTo("abc");
        assertThat(StringSanitizer.forLog(null)).isEqualTo("null");
    }

    @Test
    void headerValue_trimsAndTreatsBlankAsAbsent() {
        assertThat(StringSanitizer.headerValue("  admin ")).isEqualTo("admin");
        assertThat(StringSanitizer.headerValue("   ")).isNull();
        assertThat(StringSanitizer.headerValue(null)).isNull();
        assertThat(StringSanitizer.headerValue("abcdef", 4)).isEqualTo("abcd");
    }
}
