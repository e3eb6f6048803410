package org.audioshelf.service.resolver;

import lombok.extern.slf4j.Slf4j;
import org.audioshelf.config.AppProperties;
import org.audioshelf.config.TaskExecutorConfig;
import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.DiscardedProposal;
import org.audioshelf.model.dto.EmbeddedMetadata;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.service.metadata.EmbeddedMetadataReader;
import org.audioshelf.service.source.SourceAdapter;
import org.audioshelf.service.source.SourceCascade;
import org.audioshelf.util.FileNameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fills the canonical fields of one entity. Embedded tags come first; every field still below
 * the confidence threshold is then offered to the source cascade, highest priority first. Each
 * adapter is called at most once per entity, with every field still missing at that point.
 */
@Slf4j
@Service
public class CascadeResolver {

    private static final int MAX_RAW_HINTS = 50;

    private final SourceCascade sourceCascade;
    private final EmbeddedMetadataReader embeddedMetadataReader;
    private final AppProperties appProperties;
    private final AsyncTaskExecutor adapterExecutor;

    public CascadeResolver(SourceCascade sourceCascade, EmbeddedMetadataReader embeddedMetadataReader, AppProperties appProperties,
                           @Qualifier(TaskExecutorConfig.ADAPTER_EXECUTOR) AsyncTaskExecutor adapterExecutor) {
        this.sourceCascade = sourceCascade;
        this.embeddedMetadataReader = embeddedMetadataReader;
        this.appProperties = appProperties;
        this.adapterExecutor = adapterExecutor;
    }

    /**
     * @return a new entity with the same status; the input is not modified
     * @throws CancellationException when the calling thread is interrupted mid-cascade
     */
    public BookEntity resolve(BookEntity entity) {
        BookCandidate candidate = entity.getCandidate();
        double threshold = appProperties.getResolution().getConfidenceThreshold();
        Map<CanonicalField, FieldValue> fields = new EnumMap<>(entity.getFields());

        EmbeddedMetadata embedded = embeddedMetadataReader.read(candidate);
        for (CanonicalField field : CanonicalField.values()) {
            FieldValue current = fields.get(field);
            FieldValue fromTags = embedded.get(field);
            if (!current.isResolvedAtLeast(threshold) && fromTags.isResolved() && fromTags.getConfidence() >= current.getConfidence()) {
                fields.put(field, fromTags);
            }
        }
        String cover = embedded.getCoverImagePath() != null ? embedded.getCoverImagePath() : entity.getCoverImagePath();

        Set<CanonicalField> missing = EnumSet.noneOf(CanonicalField.class);
        Arrays.stream(CanonicalField.values())
                .filter(f -> !fields.get(f).isResolvedAtLeast(threshold))
                .forEach(missing::add);

        List<DiscardedProposal> discarded = new ArrayList<>();
        for (SourceAdapter adapter : sourceCascade.adapters()) {
            if (missing.isEmpty()) {
                break;
            }
            List<FieldProposal> proposals = callAdapter(adapter, buildRequest(candidate, fields, missing));
            for (CanonicalField field : EnumSet.copyOf(missing)) {
                List<FieldProposal> forField = proposals.stream()
                        .filter(p -> p.getField() == field && isUsable(p))
                        .toList();
                if (forField.isEmpty()) {
                    continue;
                }
                // stable sort: the earlier proposal wins a confidence tie
                FieldProposal best = forField.stream()
                        .sorted(Comparator.comparingDouble(FieldProposal::getConfidence).reversed())
                        .findFirst()
                        .orElseThrow();
                forField.stream()
                        .filter(p -> p != best && !p.getValue().equalsIgnoreCase(best.getValue()))
                        .forEach(p -> {
                            log.info("{}: discarded {} '{}' from {} in favour of '{}'", candidate.getRelativePath(),
                                    field.getKey(), p.getValue(), p.getSource().getTag(), best.getValue());
                            discarded.add(new DiscardedProposal(field, p.getValue(), p.getConfidence(), p.getSource(), best.getValue()));
                        });
                fields.put(field, FieldValue.of(best.getValue(), best.getSource(), best.getConfidence()));
                missing.remove(field);
            }
        }

        for (CanonicalField field : missing) {
            if (!fields.get(field).isResolved()) {
                log.info("{}: no source produced a value for {}", candidate.getRelativePath(), field.getKey());
            }
        }

        return entity.toBuilder()
                .fields(fields)
                .coverImagePath(cover)
                .clearDiscardedProposals()
                .discardedProposals(discarded)
                .build();
    }

    private ProposalRequest buildRequest(BookCandidate candidate, Map<CanonicalField, FieldValue> fields, Set<CanonicalField> missing) {
        ProposalRequest.ProposalRequestBuilder request = ProposalRequest.builder()
                .candidate(candidate)
                .requestedFields(EnumSet.copyOf(missing));
        fields.forEach((field, value) -> {
            if (value.isResolved() && !missing.contains(field)) {
                request.knownField(field, value.getValue());
            }
        });
        rawTextHints(candidate).forEach(request::rawTextHint);
        return request.build();
    }

    /**
     * Folder names along the relative path, then member file names.
     */
    private Set<String> rawTextHints(BookCandidate candidate) {
        Set<String> hints = new LinkedHashSet<>();
        String folder = candidate.getRelativeDirectory();
        if (folder != null && !folder.isEmpty()) {
            Arrays.stream(folder.split("/")).filter(s -> !s.isBlank()).forEach(hints::add);
        }
        candidate.getFiles().stream()
                .limit(MAX_RAW_HINTS)
                .map(Path::getFileName)
                .map(Path::toString)
                .map(FileNameUtils::stem)
                .forEach(hints::add);
        return hints;
    }

    private boolean isUsable(FieldProposal proposal) {
        if (proposal.getValue() == null || proposal.getValue().isBlank()) {
            return false;
        }
        if (proposal.getField() == CanonicalField.SERIES_INDEX) {
            return FieldValue.of(proposal.getValue(), proposal.getSource(), proposal.getConfidence()).asInteger() != null;
        }
        return true;
    }

    /**
     * Runs one adapter under the configured timeout. Timeouts, unreachable sources and adapter
     * bugs all count as "no proposals".
     */
    private List<FieldProposal> callAdapter(SourceAdapter adapter, ProposalRequest request) {
        long timeoutMs = appProperties.getResolution().getAdapterTimeout().toMillis();
        Future<List<FieldProposal>> future = adapterExecutor.submit(() -> adapter.propose(request));
        try {
            List<FieldProposal> proposals = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return proposals == null ? List.of() : proposals;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{}: {} timed out after {} ms", request.getCandidate().getRelativePath(), adapter.name(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException unavailable) {
                log.warn("{}: {} unavailable: {}", request.getCandidate().getRelativePath(), adapter.name(), unavailable.getMessage());
            } else {
                log.error("{}: {} failed", request.getCandidate().getRelativePath(), adapter.name(), cause);
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Resolution of " + request.getCandidate().getRelativePath() + " interrupted");
        }
        return List.of();
    }
}
