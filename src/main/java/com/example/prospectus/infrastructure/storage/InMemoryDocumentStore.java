package com.example.prospectus.infrastructure.storage;

import com.example.prospectus.domain.model.StoredDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps uploaded documents in memory for the lifetime of the process.
 */
@Component
public class InMemoryDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Stores the bytes under a freshly generated identifier.
     *
     * @param fileName original file name
     * @param content  PDF bytes
     * @return stored document with its identifier
     */
    public StoredDocument save(String fileName, byte[] content) {
        String fileId = UUID.randomUUID().toString().replace("-", "");
        StoredDocument document = new StoredDocument(fileId, fileName, content, Instant.now(clock));
        documents.put(fileId, document);
        log.info("Stored {} as {} ({} bytes)", fileName, fileId, document.sizeBytes());
        return document;
    }

    public Optional<StoredDocument> find(String fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(fileId));
    }

    /**
     * @return {@code true} when a document was removed
     */
    public boolean delete(String fileId) {
        return fileId != null && documents.remove(fileId) != null;
    }
}
