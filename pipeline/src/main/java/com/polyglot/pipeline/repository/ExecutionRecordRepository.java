package com.polyglot.pipeline.repository;

import com.polyglot.pipeline.model.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID> {

    /** Execution history of one document, newest first. */
    List<ExecutionRecord> findByDocumentIdOrderByCreatedAtDesc(String documentId);
}
