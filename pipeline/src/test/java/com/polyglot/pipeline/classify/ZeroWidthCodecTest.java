package com.polyglot.pipeline.classify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ZeroWidthCodecTest {

    @Test
    void encode_producesEightInvisibleCharsPerByte() {
        String encoded = ZeroWidthCodec.encode("A");   // 0x41 = 01000001

        assertThat(encoded).isEqualTo("\u200B\u200C\u200B\u200B\u200B\u200B\u200B\u200C");
        assertThat(ZeroWidthCodec.strip(encoded)).isEmpty();
    }

    @Test
    void hide_appendsInvisiblePayloadThatScannerRecovers() {
        String hidden = ZeroWidthCodec.hide("Visible text.", "deploy");

        assertThat(ZeroWidthCodec.strip(hidden)).isEqualTo("Visible text.");
        assertThat(ZeroWidthScanner.scan(hidden)).singleElement()
                .satisfies(h -> assertThat(h.payload()).isEqualTo("deploy"));
    }

    @Test
    void decode_readsMultiByteUtf8() {
        assertThat(ZeroWidthCodec.decode(ZeroWidthCodec.encode("héllo"))).contains("héllo");
    }

    @Test
    void decode_rejectsRunsThatAreNotPayloads() {
        assertThat(ZeroWidthCodec.decode("\u200B\u200C\u200B")).isEmpty();          // not a whole byte
        assertThat(ZeroWidthCodec.decode("\u200D".repeat(8))).isEmpty();             // joiner is not a bit
        assertThat(ZeroWidthCodec.decode("\u200C".repeat(8))).isEmpty();             // 0xFF is not UTF-8
    }

    @Test
    void strip_removesEveryZeroWidthCodePoint() {
        assertThat(ZeroWidthCodec.strip("a\u200Bb\u200Cc\u200Dd\u2060e\uFEFF")).isEqualTo("abcde");
    }

    @Test
    void scanner_reportsOffsetAndLengthOfEachRun() {
        String text = "x\u200B\u200Cy" + ZeroWidthCodec.encode("ok");

        assertThat(ZeroWidthScanner.scan(text)).containsExactly(
                new HiddenPayload(1, 2, null),
                new HiddenPayload(4, 16, "ok"));
    }
}
