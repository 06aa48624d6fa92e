package com.libragraph.evidence.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class XmlTextTest {

    @Test
    void shouldStripIllegalCharacters() {
        assertThat(XmlText.sanitize("ok\u0000text\u000B")).isEqualTo("oktext");
        assertThat(XmlText.sanitize(null)).isEmpty();
    }

    @Test
    void shouldKeepWhitespaceAndSupplementaryCharacters() {
        String text = "tab\tnewline\n\uD83D\uDE00";

        assertThat(XmlText.sanitize(text)).isSameAs(text);
    }
}
