package com.polyglot.pipeline.document;

import java.util.Optional;

/** Source of raw document text, keyed by document id. */
public interface DocumentProvider {

    Optional<String> getDocument(String id);
}
