package com.polyglot.pipeline.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.pipeline.execute.ExecutionResult;
import com.polyglot.pipeline.model.ExecutionRecord;
import com.polyglot.pipeline.repository.ExecutionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Appends one {@code execution_records} row per stored result. */
@Component
public class JpaResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(JpaResultSink.class);

    private final ExecutionRecordRepository records;
    private final ObjectMapper              json;

    public JpaResultSink(ExecutionRecordRepository records, ObjectMapper objectMapper) {
        this.records = records;
        this.json    = objectMapper;
    }

    @Override
    @Transactional
    public void store(String documentId, ExecutionResult result) {
        String details;
        try {
            details = json.writeValueAsString(result.details());
        } catch (JsonProcessingException e) {
            throw new ResultSinkException("Failed to serialise result for document " + documentId, e);
        }
        try {
            ExecutionRecord saved = records.saveAndFlush(
                    new ExecutionRecord(documentId, result.language(), result.ok(), details));
            log.info("Stored execution {} for document {} (ok={})", saved.getId(), documentId, result.ok());
        } catch (DataAccessException e) {
            throw new ResultSinkException("Failed to store result for document " + documentId, e);
        }
    }
}
