package org.audioshelf.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.ApiError;
import org.audioshelf.exception.PersistenceException;
import org.audioshelf.mapper.BookEntityMapper;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.store.BookEntityRecord;
import org.audioshelf.model.enums.ApprovalStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory entities plus their persisted document. Entities are immutable and replaced per id,
 * so status changes and resolution results for different entities never contend.
 * <p>
 * Saving merges by id against the document currently on disk: only entities changed in this
 * session are written, every other record on disk is kept as found.
 */
@Slf4j
@Service
public class ApprovalStore {

    private static final TypeReference<Map<String, BookEntityRecord>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ConcurrentMap<String, BookEntity> entities = new ConcurrentHashMap<>();
    private final Set<String> dirtyIds = ConcurrentHashMap.newKeySet();
    private final Map<String, BookEntityRecord> persisted = new ConcurrentHashMap<>();
    private final Object documentLock = new Object();
    private volatile boolean documentRead;

    private final ObjectMapper objectMapper;
    private final BookEntityMapper bookEntityMapper;
    private final AppProperties appProperties;

    public ApprovalStore(ObjectMapper objectMapper, BookEntityMapper bookEntityMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        this.bookEntityMapper = bookEntityMapper;
        this.appProperties = appProperties;
    }

    public List<BookEntity> list() {
        return entities.values().stream()
                .sorted(Comparator.comparing(e -> Objects.toString(e.getCandidate().getRelativePath(), "")))
                .toList();
    }

    public Optional<BookEntity> get(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public BookEntity getOrThrow(String id) {
        return get(id).orElseThrow(() -> ApiError.ENTITY_NOT_FOUND.createException(id));
    }

    /**
     * Changes only the status of one entity; fields are left as they are.
     */
    public BookEntity setStatus(String id, ApprovalStatus status) {
        if (status == null) {
            throw ApiError.INVALID_STATUS.createException("null");
        }
        BookEntity updated = entities.computeIfPresent(id, (k, current) -> current.withStatus(status));
        if (updated == null) {
            throw ApiError.ENTITY_NOT_FOUND.createException(id);
        }
        dirtyIds.add(id);
        log.info("Entity {} marked {}", id, status.toJson());
        return updated;
    }

    /**
     * Stores a resolution result. The status held in the store wins over the one carried by the
     * result, since an approval may have landed while the entity was being resolved.
     */
    public BookEntity updateFields(BookEntity resolved) {
        BookEntity stored = entities.compute(resolved.getId(),
                (k, current) -> current == null ? resolved : resolved.withStatus(current.getStatus()));
        dirtyIds.add(resolved.getId());
        return stored;
    }

    /**
     * Adds the candidates of a scan. An id already known keeps its status, and keeps its fields
     * too as long as its member files are unchanged.
     */
    public List<BookEntity> register(List<BookCandidate> candidates) {
        readDocumentOnce();
        for (BookCandidate candidate : candidates) {
            entities.compute(candidate.getId(), (id, current) -> {
                BookEntity previous = current != null ? current : fromPersisted(id);
                if (previous == null || !sameFiles(previous, candidate)) {
                    dirtyIds.add(id);
                }
                return reseed(candidate, previous);
            });
        }
        return candidates.stream().map(c -> entities.get(c.getId())).toList();
    }

    /**
     * Reads the document the first time entities are registered, so ids saved by an earlier
     * process come back with their decisions even when {@link #load()} is never called.
     */
    private void readDocumentOnce() {
        if (documentRead) {
            return;
        }
        Path storeFile = storeFile();
        synchronized (documentLock) {
            if (documentRead) {
                return;
            }
            try {
                persisted.putAll(readDocument(storeFile));
                documentRead = true;
            } catch (PersistenceException e) {
                log.warn("Stored decisions unavailable, new entities start pending: {}", e.getMessage());
            }
        }
    }

    private static boolean sameFiles(BookEntity previous, BookCandidate candidate) {
        return previous.getCandidate().getFiles().equals(candidate.getFiles());
    }

    private BookEntity fromPersisted(String id) {
        BookEntityRecord record = persisted.get(id);
        return record == null ? null : bookEntityMapper.toEntity(record);
    }

    private BookEntity reseed(BookCandidate candidate, BookEntity previous) {
        if (previous == null) {
            return BookEntity.pending(candidate);
        }
        if (sameFiles(previous, candidate)) {
            return previous.toBuilder().candidate(candidate).build();
        }
        log.info("Entity {} changed members since last scan; fields reset, status {} kept", candidate.getId(), previous.getStatus());
        return BookEntity.pending(candidate).withStatus(previous.getStatus());
    }

    /**
     * Writes every entity changed in this session into the on-disk document, keeping all other
     * records already there. On failure nothing in memory changes and the save can be retried.
     */
    public int save() {
        Path storeFile = storeFile();
        synchronized (documentLock) {
            Map<String, BookEntityRecord> document = new TreeMap<>(readDocument(storeFile));
            Map<String, BookEntity> written = new HashMap<>();
            for (String id : Set.copyOf(dirtyIds)) {
                BookEntity entity = entities.get(id);
                if (entity != null) {
                    document.put(id, bookEntityMapper.toRecord(entity));
                    written.put(id, entity);
                }
            }
            writeDocument(storeFile, document);

            persisted.putAll(document);
            documentRead = true;
            // an entity replaced while the document was being written stays dirty
            written.forEach((id, entity) -> {
                if (entities.get(id) == entity) {
                    dirtyIds.remove(id);
                }
            });
            log.info("Saved {} changed entities to {} ({} records total)", written.size(), storeFile, document.size());
            return written.size();
        }
    }

    /**
     * Reads the document and merges it into memory. Entities already in memory take the stored
     * status, and the stored fields when their member files match; unknown ids are added as
     * stored.
     */
    public int load() {
        Path storeFile = storeFile();
        synchronized (documentLock) {
            Map<String, BookEntityRecord> document = readDocument(storeFile);
            persisted.putAll(document);
            documentRead = true;
            for (Map.Entry<String, BookEntityRecord> entry : document.entrySet()) {
                BookEntity stored = bookEntityMapper.toEntity(entry.getValue());
                entities.compute(entry.getKey(), (id, current) -> {
                    if (current == null) {
                        return stored;
                    }
                    boolean sameFiles = stored.getCandidate().getFiles().equals(current.getCandidate().getFiles());
                    BookEntity merged = sameFiles
                            ? stored.toBuilder().candidate(current.getCandidate()).build()
                            : current.withStatus(stored.getStatus());
                    return merged;
                });
            }
            log.info("Loaded {} records from {}", document.size(), storeFile);
            return document.size();
        }
    }

    private Path storeFile() {
        return Path.of(appProperties.getStoreFile()).toAbsolutePath().normalize();
    }

    private Map<String, BookEntityRecord> readDocument(Path storeFile) {
        if (!Files.exists(storeFile)) {
            return Map.of();
        }
        try {
            Map<String, BookEntityRecord> document = objectMapper.readValue(storeFile.toFile(), DOCUMENT_TYPE);
            if (document == null) {
                return Map.of();
            }
            document.forEach((id, record) -> {
                if (record.getId() == null) {
                    record.setId(id);
                }
            });
            return document;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + storeFile + ": " + e.getMessage(), e);
        }
    }

    private void writeDocument(Path storeFile, Map<String, BookEntityRecord> document) {
        Path temp = null;
        try {
            Path parent = storeFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, storeFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Failed to write " + storeFile + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
