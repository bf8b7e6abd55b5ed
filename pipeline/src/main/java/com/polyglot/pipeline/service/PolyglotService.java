package com.polyglot.pipeline.service;

import com.polyglot.pipeline.classify.MetadataExtractor;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.classify.PolyglotParser;
import com.polyglot.pipeline.classify.ZeroWidthCodec;
import com.polyglot.pipeline.document.DocumentProvider;
import com.polyglot.pipeline.document.ResultSink;
import com.polyglot.pipeline.document.ResultSinkException;
import com.polyglot.pipeline.execute.ExecutionResult;
import com.polyglot.pipeline.execute.ExecutorRegistry;
import com.polyglot.pipeline.sanitize.Sanitizer;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.Transpilation;
import com.polyglot.pipeline.transpile.Transpilers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Front door of the pipeline. Text-only operations are pure; the document
 * operations load through {@link DocumentProvider} and report through
 * {@link ResultSink}.
 */
@Service
public class PolyglotService {

    private static final Logger log = LoggerFactory.getLogger(PolyglotService.class);

    private final DocumentProvider documents;
    private final ResultSink       sink;
    private final ExecutorRegistry executors;

    public PolyglotService(DocumentProvider documents,
                           ResultSink sink,
                           ExecutorRegistry executors) {
        this.documents = documents;
        this.sink      = sink;
        this.executors = executors;
    }

    // ------------------------------------------------------------------
    // Text operations
    // ------------------------------------------------------------------

    public Polyglot parse(String content) {
        return PolyglotParser.parse(content);
    }

    public boolean isPolyglot(String content) {
        return MetadataExtractor.isPolyglot(content);
    }

    public String sanitize(String content) {
        return Sanitizer.sanitize(content);
    }

    /** Embeds {@code payload} at the end of {@code content} in zero-width characters. */
    public String conceal(String content, String payload) {
        return ZeroWidthCodec.hide(content, payload);
    }

    public Transpilation transpile(String content, Target target) {
        return Transpilers.transpile(parse(content), target);
    }

    // ------------------------------------------------------------------
    // Stored documents
    // ------------------------------------------------------------------

    public Optional<Polyglot> parseDocument(String documentId) {
        return documents.getDocument(documentId).map(this::parse);
    }

    /**
     * Load, parse, execute and store. Empty when the document does not exist.
     * A sink failure does not undo the execution; it is reported as
     * {@code stored = false}.
     */
    public Optional<DocumentExecution> executeDocument(String documentId) {
        Optional<String> content = documents.getDocument(documentId);
        if (content.isEmpty()) {
            log.info("Document {} not found", documentId);
            return Optional.empty();
        }

        MDC.put("documentId", documentId);
        try {
            Polyglot polyglot = parse(content.get());
            MDC.put("language", polyglot.language().wireName());
            log.info("Executing document {} as {} ({} artifacts)",
                    documentId, polyglot.language().wireName(), polyglot.artifacts().size());

            ExecutionResult result = executors.execute(polyglot);
            log.info("Document {} finished: ok={}", documentId, result.ok());

            boolean stored = true;
            try {
                sink.store(documentId, result);
            } catch (ResultSinkException e) {
                log.warn("Result for document {} was not stored: {}", documentId, e.getMessage());
                stored = false;
            }
            return Optional.of(new DocumentExecution(documentId, result, stored));
        } finally {
            MDC.remove("documentId");
            MDC.remove("language");
        }
    }
}
