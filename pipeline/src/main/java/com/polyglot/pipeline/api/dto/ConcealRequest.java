package com.polyglot.pipeline.api.dto;

/**
 * Request body for POST /polyglot/conceal. Missing fields are empty strings.
 */
public record ConcealRequest(String content, String payload) {

    public ConcealRequest {
        if (content == null) content = "";
        if (payload == null) payload = "";
    }
}
