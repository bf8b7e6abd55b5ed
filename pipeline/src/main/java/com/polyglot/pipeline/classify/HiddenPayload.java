package com.polyglot.pipeline.classify;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A run of zero-width characters.
 *
 * @param offset  char offset of the run in the document
 * @param length  number of zero-width characters
 * @param payload decoded text, or null when the run does not decode
 */
public record HiddenPayload(int offset, int length, String payload) {

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("offset", offset);
        map.put("length", length);
        if (payload != null) {
            map.put("payload", payload);
        }
        return map;
    }
}
