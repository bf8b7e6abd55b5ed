package com.polyglot.pipeline.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A stored Markdown document, addressed by an external string id.
 *
 * DB table: documents  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "documents")
public class Document {

    @Id
    private String id;

    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Document() {}   // required by JPA

    public Document(String id, String title, String content) {
        this.id      = id;
        this.title   = title;
        this.content = content;
    }

    public String  getId()        { return id; }
    public String  getTitle()     { return title; }
    public String  getContent()   { return content; }
    public Instant getCreatedAt() { return createdAt; }

    public void setContent(String content) { this.content = content; }
}
