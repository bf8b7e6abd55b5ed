package com.polyglot.pipeline.classify;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Bit-level encoding of text into invisible code points.
 *
 * U+200B is a 0 bit and U+200C a 1 bit, eight bits per byte, most significant
 * bit first, bytes in UTF-8. Runs that contain other zero-width characters
 * (U+200D, U+2060, U+FEFF) are detected but not decodable.
 */
public final class ZeroWidthCodec {

    public static final char ZERO_BIT = '\u200B';
    public static final char ONE_BIT  = '\u200C';

    private static final String ZERO_WIDTH = "\u200B\u200C\u200D\u2060\uFEFF";

    private ZeroWidthCodec() {}

    public static boolean isZeroWidth(char c) {
        return ZERO_WIDTH.indexOf(c) >= 0;
    }

    public static boolean containsZeroWidth(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (isZeroWidth(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /** Removes every zero-width character. */
    public static String strip(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isZeroWidth(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Appends {@code payload} to {@code text} as an invisible run. */
    public static String hide(String text, String payload) {
        return text + encode(payload);
    }

    public static String encode(String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 8);
        for (byte b : bytes) {
            for (int bit = 7; bit >= 0; bit--) {
                sb.append(((b >> bit) & 1) == 1 ? ONE_BIT : ZERO_BIT);
            }
        }
        return sb.toString();
    }

    /** Decodes a run produced by {@link #encode}; empty when the run is not a valid payload. */
    public static Optional<String> decode(String run) {
        if (run.isEmpty() || run.length() % 8 != 0) {
            return Optional.empty();
        }
        byte[] bytes = new byte[run.length() / 8];
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            int bit;
            if (c == ZERO_BIT) {
                bit = 0;
            } else if (c == ONE_BIT) {
                bit = 1;
            } else {
                return Optional.empty();
            }
            bytes[i / 8] = (byte) ((bytes[i / 8] << 1) | bit);
        }
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
