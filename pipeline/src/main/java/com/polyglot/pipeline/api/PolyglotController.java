package com.polyglot.pipeline.api;

import com.polyglot.pipeline.api.dto.CheckResponse;
import com.polyglot.pipeline.api.dto.ConcealRequest;
import com.polyglot.pipeline.api.dto.ContentRequest;
import com.polyglot.pipeline.api.dto.ContentResponse;
import com.polyglot.pipeline.api.dto.ExecuteResponse;
import com.polyglot.pipeline.api.dto.ParseResponse;
import com.polyglot.pipeline.api.dto.TranspileFailureResponse;
import com.polyglot.pipeline.service.PolyglotService;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.Transpilation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for the polyglot pipeline.
 *
 * POST /polyglot/parse                  - classify and parse Markdown
 * POST /polyglot/check                  - is this a polyglot document?
 * POST /polyglot/sanitize               - strip directives and hidden payloads
 * POST /polyglot/conceal                - append a zero-width payload
 * POST /polyglot/transpile?target=...   - target configuration, 422 if the artifact is missing
 * GET  /documents/{id}/polyglot         - parse a stored document
 * POST /documents/{id}/execute          - run a stored document and record the result
 */
@RestController
public class PolyglotController {

    private final PolyglotService polyglotService;

    public PolyglotController(PolyglotService polyglotService) {
        this.polyglotService = polyglotService;
    }

    @PostMapping("/polyglot/parse")
    public ParseResponse parse(@RequestBody ContentRequest req) {
        return ParseResponse.from(polyglotService.parse(req.content()));
    }

    @PostMapping("/polyglot/check")
    public CheckResponse check(@RequestBody ContentRequest req) {
        return new CheckResponse(polyglotService.isPolyglot(req.content()));
    }

    @PostMapping("/polyglot/sanitize")
    public ContentResponse sanitize(@RequestBody ContentRequest req) {
        return new ContentResponse(polyglotService.sanitize(req.content()));
    }

    @PostMapping("/polyglot/conceal")
    public ContentResponse conceal(@RequestBody ConcealRequest req) {
        return new ContentResponse(polyglotService.conceal(req.content(), req.payload()));
    }

    /**
     * Example:
     *   curl -X POST 'http://localhost:8080/polyglot/transpile?target=docker' \
     *     -H "Content-Type: application/json" \
     *     -d '{"content":"```dockerfile\nFROM alpine\n```"}'
     */
    @PostMapping("/polyglot/transpile")
    public ResponseEntity<?> transpile(@RequestParam String target, @RequestBody ContentRequest req) {
        Target t = Target.fromWireName(target).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown target: " + target));

        Transpilation result = polyglotService.transpile(req.content(), t);
        if (result instanceof Transpilation.Success s) {
            return ResponseEntity.ok(s.config());
        }
        return ResponseEntity.unprocessableEntity()
                .body(TranspileFailureResponse.from((Transpilation.Failure) result));
    }

    /** Returns 404 if the document ID is not found. */
    @GetMapping("/documents/{id}/polyglot")
    public ParseResponse parseDocument(@PathVariable String id) {
        return polyglotService.parseDocument(id)
                .map(ParseResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Document not found: " + id));
    }

    /**
     * Execute a stored document with the executor for its language.
     * A missing tool yields a mock success, not an error.
     * Returns 404 if the document ID is not found.
     */
    @PostMapping("/documents/{id}/execute")
    public ExecuteResponse execute(@PathVariable String id) {
        return polyglotService.executeDocument(id)
                .map(ExecuteResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Document not found: " + id));
    }
}
