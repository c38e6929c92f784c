package com.example.KbRag.service;

import com.example.KbRag.model.KbDocument;
import com.example.KbRag.repository.PassageSearchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Document metadata lookups, memoized for a few minutes since documents only change on re-ingestion.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final PassageSearchRepository repository;
    private final ResultCache<String, KbDocument> documentCache;

    public DocumentService(
            PassageSearchRepository repository,
            @Qualifier("documentCache") ResultCache<String, KbDocument> documentCache
    ) {
        this.repository = repository;
        this.documentCache = documentCache;
    }

    public Optional<KbDocument> findById(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id must not be empty");
        }

        Optional<KbDocument> cached = documentCache.get(documentId);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<KbDocument> loaded = repository.findDocumentById(documentId);
        loaded.ifPresent(doc -> documentCache.put(documentId, doc));
        log.debug("Document {} loaded from storage (found: {})", documentId, loaded.isPresent());
        return loaded;
    }
}
