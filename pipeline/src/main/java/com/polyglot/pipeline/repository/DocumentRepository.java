package com.polyglot.pipeline.repository;

import com.polyglot.pipeline.model.Document;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DocumentRepository extends JpaRepository<Document, String> {
}
