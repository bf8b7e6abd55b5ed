package com.polyglot.pipeline.model;

import com.polyglot.pipeline.classify.Language;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a stored document. Details are kept as the JSON the
 * API returned, so the shape can vary per language without schema changes.
 *
 * DB table: execution_records
 */
@Entity
@Table(name = "execution_records")
public class ExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "document_id", nullable = false)
    private String documentId;

    // Wire name of the language, e.g. "kubernetes".
    @Column(nullable = false)
    private String language;

    @Column(nullable = false)
    private boolean ok;

    @Column(name = "details_json", nullable = false, columnDefinition = "TEXT")
    private String detailsJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ExecutionRecord() {}   // required by JPA

    public ExecutionRecord(String documentId, Language language, boolean ok, String detailsJson) {
        this.documentId  = documentId;
        this.language    = language.wireName();
        this.ok          = ok;
        this.detailsJson = detailsJson;
    }

    public UUID    getId()          { return id; }
    public String  getDocumentId()  { return documentId; }
    public String  getLanguage()    { return language; }
    public boolean isOk()           { return ok; }
    public String  getDetailsJson() { return detailsJson; }
    public Instant getCreatedAt()   { return createdAt; }
}
