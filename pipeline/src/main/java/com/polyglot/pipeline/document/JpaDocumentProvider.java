package com.polyglot.pipeline.document;

import com.polyglot.pipeline.model.Document;
import com.polyglot.pipeline.repository.DocumentRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
public class JpaDocumentProvider implements DocumentProvider {

    private final DocumentRepository documents;

    public JpaDocumentProvider(DocumentRepository documents) {
        this.documents = documents;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> getDocument(String id) {
        return documents.findById(id).map(Document::getContent);
    }
}
