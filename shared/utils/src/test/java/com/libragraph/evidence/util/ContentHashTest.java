package com.libragraph.evidence.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    @Test
    void shouldDigestKnownInput() {
        ContentHash hash = ContentHash.ofText("abc");

        assertThat(hash.toHex()).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
        assertThat(hash.toHex()).hasSize(40);
    }

    @Test
    void shouldDefensiveCopyOnConstruction() {
        byte[] bytes = new byte[20];
        bytes[0] = (byte) 0x01;
        ContentHash hash = new ContentHash(bytes);

        // mutating the source array must not change the hash
        bytes[0] = (byte) 0xFF;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);

        hash.bytes()[0] = (byte) 0x7F;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectNullBytes() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentHash(null));
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[16]))
                .withMessageContaining("20 bytes");
    }

    @Test
    void shouldRoundTripHex() {
        String hex = "0123456789abcdef0123456789abcdef01234567";
        ContentHash hash = ContentHash.fromHex(hex);

        assertThat(hash.toHex()).isEqualTo(hex);
        assertThat(hash.toString()).isEqualTo(hex);
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("abcd"))
                .withMessageContaining("40 characters");
    }

    @Test
    void shouldRejectInvalidHexCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("zzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzz"));
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.ofText("same");
        ContentHash b = ContentHash.ofText("same");
        ContentHash c = ContentHash.ofText("other");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }
}
