package org.audioshelf.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.ApiError;
import org.audioshelf.model.dto.BatchResult;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.service.library.BookGrouper;
import org.audioshelf.service.resolver.ResolutionBatchService;
import org.audioshelf.service.store.ApprovalStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for the UI: scan a tree, inspect and resolve entities, record approval decisions
 * and persist them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookOrganizerService {

    private final BookGrouper bookGrouper;
    private final ResolutionBatchService resolutionBatchService;
    private final ApprovalStore approvalStore;
    private final AppProperties appProperties;

    /**
     * Groups the tree under {@code rootPath} (or the configured library root when blank) and
     * registers the resulting entities. Known ids keep their approval status.
     */
    public List<BookEntity> scan(String rootPath) {
        Path root = resolveRoot(rootPath);
        List<BookCandidate> candidates;
        try {
            candidates = bookGrouper.group(root);
        } catch (IOException e) {
            log.error("Failed to scan {}", root, e);
            throw ApiError.SCAN_FAILED.createException(root, e.getMessage());
        }
        return approvalStore.register(candidates);
    }

    public List<BookEntity> listEntities() {
        return approvalStore.list();
    }

    public BookEntity getEntity(String id) {
        return approvalStore.getOrThrow(id);
    }

    public BookEntity resolve(String id) {
        return resolutionBatchService.resolveOne(id);
    }

    public BatchResult resolveAll() {
        List<String> ids = approvalStore.list().stream().map(BookEntity::getId).toList();
        return resolutionBatchService.resolveAll(ids);
    }

    public BatchResult resolveAll(List<BookEntity> entities) {
        return resolutionBatchService.resolveAll(entities.stream().map(BookEntity::getId).toList());
    }

    public boolean cancelBatch() {
        return resolutionBatchService.cancelBatch();
    }

    public BookEntity setStatus(String id, ApprovalStatus status) {
        return approvalStore.setStatus(id, status);
    }

    public int save() {
        return approvalStore.save();
    }

    public int load() {
        return approvalStore.load();
    }

    private Path resolveRoot(String rootPath) {
        String effective = StringUtils.isNotBlank(rootPath) ? rootPath : appProperties.getLibraryRoot();
        if (StringUtils.isBlank(effective)) {
            throw ApiError.LIBRARY_ROOT_NOT_CONFIGURED.createException();
        }
        Path root = Path.of(effective);
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw ApiError.DIRECTORY_NOT_FOUND.createException(effective);
        }
        return root;
    }
}
