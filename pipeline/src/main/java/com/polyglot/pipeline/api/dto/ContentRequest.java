package com.polyglot.pipeline.api.dto;

/**
 * Request body for the text endpoints under /polyglot.
 * A missing content field is treated as an empty document.
 */
public record ContentRequest(String content) {

    public ContentRequest {
        if (content == null) content = "";
    }
}
