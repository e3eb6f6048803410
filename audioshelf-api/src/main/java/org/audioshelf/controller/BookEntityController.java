package org.audioshelf.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.audioshelf.mapper.BookEntityMapper;
import org.audioshelf.model.dto.BatchResult;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.request.ScanRequest;
import org.audioshelf.model.dto.request.StatusUpdateRequest;
import org.audioshelf.model.dto.store.BookEntityRecord;
import org.audioshelf.service.BookOrganizerService;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/entities")
@AllArgsConstructor
@Tag(name = "Book Entities", description = "Endpoints for scanning audiobook trees, resolving metadata and approving entities")
public class BookEntityController {

    private final BookOrganizerService bookOrganizerService;
    private final BookEntityMapper bookEntityMapper;

    @Operation(summary = "Scan a directory", description = "Group the audio files under a directory into book entities, optionally resolving them right away.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entities found by the scan"),
            @ApiResponse(responseCode = "400", description = "Directory missing or no root configured")
    })
    @PostMapping("/scan")
    public ResponseEntity<List<BookEntityRecord>> scan(@Parameter(description = "Scan request") @RequestBody(required = false) ScanRequest request) {
        String rootPath = request == null ? null : request.getRootPath();
        List<BookEntity> entities = bookOrganizerService.scan(rootPath);
        if (request != null && request.isResolve()) {
            bookOrganizerService.resolveAll(entities);
            entities = entities.stream().map(e -> bookOrganizerService.getEntity(e.getId())).toList();
        }
        return ResponseEntity.ok(bookEntityMapper.toRecords(entities));
    }

    @Operation(summary = "List entities", description = "All entities known in this session, complete or not.")
    @ApiResponse(responseCode = "200", description = "Entities returned successfully")
    @GetMapping
    public ResponseEntity<List<BookEntityRecord>> listEntities() {
        return ResponseEntity.ok(bookEntityMapper.toRecords(bookOrganizerService.listEntities()));
    }

    @Operation(summary = "Get an entity", description = "Fields, provenance, cover and status of one entity.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entity returned successfully"),
            @ApiResponse(responseCode = "404", description = "Entity not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<BookEntityRecord> getEntity(@Parameter(description = "ID of the entity") @PathVariable String id) {
        return ResponseEntity.ok(bookEntityMapper.toRecord(bookOrganizerService.getEntity(id)));
    }

    @Operation(summary = "Resolve an entity", description = "Run or rerun the metadata cascade for one entity. The approval status is not changed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entity resolved"),
            @ApiResponse(responseCode = "404", description = "Entity not found")
    })
    @PostMapping("/{id}/resolve")
    public ResponseEntity<BookEntityRecord> resolve(@Parameter(description = "ID of the entity") @PathVariable String id) {
        return ResponseEntity.ok(bookEntityMapper.toRecord(bookOrganizerService.resolve(id)));
    }

    @Operation(summary = "Resolve all entities", description = "Run the cascade for every entity on the bounded resolution pool.")
    @ApiResponse(responseCode = "200", description = "Batch finished or was cancelled")
    @PostMapping("/resolve")
    public ResponseEntity<BatchResult> resolveAll() {
        return ResponseEntity.ok(bookOrganizerService.resolveAll());
    }

    @Operation(summary = "Cancel the running batch", description = "Entities resolved so far are kept.")
    @ApiResponse(responseCode = "200", description = "Whether a batch was running")
    @PostMapping("/resolve/cancel")
    public ResponseEntity<Map<String, Boolean>> cancelBatch() {
        return ResponseEntity.ok(Map.of("cancelled", bookOrganizerService.cancelBatch()));
    }

    @Operation(summary = "Approve or reject an entity", description = "Set the approval status of one entity. Fields are left untouched.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status updated"),
            @ApiResponse(responseCode = "404", description = "Entity not found")
    })
    @PutMapping("/{id}/status")
    public ResponseEntity<BookEntityRecord> setStatus(
            @Parameter(description = "ID of the entity") @PathVariable String id,
            @Parameter(description = "New status") @Validated @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(bookEntityMapper.toRecord(bookOrganizerService.setStatus(id, request.getStatus())));
    }

    @Operation(summary = "Save decisions", description = "Merge the entities changed in this session into the persisted document.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Number of entities written"),
            @ApiResponse(responseCode = "500", description = "Document could not be written; nothing was lost in memory")
    })
    @PostMapping("/save")
    public ResponseEntity<Map<String, Integer>> save() {
        return ResponseEntity.ok(Map.of("saved", bookOrganizerService.save()));
    }

    @Operation(summary = "Load decisions", description = "Merge the persisted document into memory, re-seeding statuses of rescanned entities.")
    @ApiResponse(responseCode = "200", description = "Number of records read")
    @PostMapping("/load")
    public ResponseEntity<Map<String, Integer>> load() {
        return ResponseEntity.ok(Map.of("loaded", bookOrganizerService.load()));
    }
}
