package org.audioshelf.service.resolver;

import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.DiscardedProposal;
import org.audioshelf.model.dto.EmbeddedMetadata;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.metadata.EmbeddedMetadataReader;
import org.audioshelf.service.source.SourceAdapter;
import org.audioshelf.service.source.SourceCascade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CascadeResolverTest {

    private static final Path DIR = Path.of("/library/Frank Herbert/Dune");

    @Mock
    private EmbeddedMetadataReader embeddedMetadataReader;

    @Mock
    private SourceAdapter catalog;

    @Mock
    private SourceAdapter heuristic;

    private AppProperties appProperties;
    private CascadeResolver resolver;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        lenient().when(catalog.provenance()).thenReturn(Provenance.CATALOG_API);
        lenient().when(heuristic.provenance()).thenReturn(Provenance.HEURISTIC);
        resolver = new CascadeResolver(new SourceCascade(List.of(catalog, heuristic)), embeddedMetadataReader,
                appProperties, new SimpleAsyncTaskExecutor("adapter-test-"));
    }

    @Test
    void resolve_shouldNotCallAnySourceWhenTagsAreComplete() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder()
                .field(CanonicalField.AUTHOR, metadata("Frank Herbert"))
                .field(CanonicalField.SERIES, metadata("Dune Chronicles"))
                .field(CanonicalField.SERIES_INDEX, metadata("1"))
                .field(CanonicalField.TITLE, metadata("Dune"))
                .build());

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getFields().values()).allSatisfy(v -> assertThat(v.getSource()).isEqualTo(Provenance.METADATA));
        verify(catalog, never()).propose(any());
        verify(heuristic, never()).propose(any());
    }

    @Test
    void resolve_shouldAskLaterSourcesOnlyForFieldsStillMissing() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder()
                .field(CanonicalField.AUTHOR, metadata("Frank Herbert"))
                .build());
        when(catalog.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune", 0.8, Provenance.CATALOG_API)));
        when(heuristic.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune Part", 0.3, Provenance.HEURISTIC),
                new FieldProposal(CanonicalField.SERIES, "Dune Chronicles", 0.3, Provenance.HEURISTIC)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        ArgumentCaptor<ProposalRequest> catalogRequest = ArgumentCaptor.forClass(ProposalRequest.class);
        verify(catalog).propose(catalogRequest.capture());
        assertThat(catalogRequest.getValue().getRequestedFields())
                .containsExactlyInAnyOrder(CanonicalField.SERIES, CanonicalField.SERIES_INDEX, CanonicalField.TITLE);
        assertThat(catalogRequest.getValue().getKnownFields()).containsEntry(CanonicalField.AUTHOR, "Frank Herbert");
        assertThat(catalogRequest.getValue().getRawTextHints()).containsExactly("Frank Herbert", "Dune", "01", "02");

        ArgumentCaptor<ProposalRequest> heuristicRequest = ArgumentCaptor.forClass(ProposalRequest.class);
        verify(heuristic).propose(heuristicRequest.capture());
        assertThat(heuristicRequest.getValue().getRequestedFields())
                .containsExactlyInAnyOrder(CanonicalField.SERIES, CanonicalField.SERIES_INDEX);
        assertThat(heuristicRequest.getValue().getKnownFields()).containsEntry(CanonicalField.TITLE, "Dune");

        assertThat(resolved.getField(CanonicalField.TITLE)).isEqualTo(FieldValue.of("Dune", Provenance.CATALOG_API, 0.8));
        assertThat(resolved.getField(CanonicalField.SERIES)).isEqualTo(FieldValue.of("Dune Chronicles", Provenance.HEURISTIC, 0.3));
        assertThat(resolved.getField(CanonicalField.SERIES_INDEX).isResolved()).isFalse();
        assertThat(resolved.isComplete()).isTrue();
    }

    @Test
    void resolve_shouldKeepLosingProposalsForAudit() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune Messiah", 0.6, Provenance.CATALOG_API),
                new FieldProposal(CanonicalField.TITLE, "Dune", 0.8, Provenance.CATALOG_API),
                new FieldProposal(CanonicalField.TITLE, "dune", 0.4, Provenance.CATALOG_API)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getField(CanonicalField.TITLE).getValue()).isEqualTo("Dune");
        assertThat(resolved.getDiscardedProposals()).containsExactly(
                new DiscardedProposal(CanonicalField.TITLE, "Dune Messiah", 0.6, Provenance.CATALOG_API, "Dune"));
    }

    @Test
    void resolve_shouldPreferEarlierProposalOnConfidenceTie() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.AUTHOR, "Frank Herbert", 0.7, Provenance.CATALOG_API),
                new FieldProposal(CanonicalField.AUTHOR, "Brian Herbert", 0.7, Provenance.CATALOG_API)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getField(CanonicalField.AUTHOR).getValue()).isEqualTo("Frank Herbert");
    }

    @Test
    void resolve_shouldIgnoreNonNumericSeriesIndex() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.SERIES_INDEX, "first", 0.8, Provenance.CATALOG_API)));
        when(heuristic.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.SERIES_INDEX, "1", 0.3, Provenance.HEURISTIC)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getField(CanonicalField.SERIES_INDEX)).isEqualTo(FieldValue.of("1", Provenance.HEURISTIC, 0.3));
    }

    @Test
    void resolve_shouldMoveOnWhenSourceIsUnavailable() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenThrow(new SourceUnavailableException("catalog_api", "HTTP 503"));
        when(heuristic.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune", 0.3, Provenance.HEURISTIC)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getField(CanonicalField.TITLE).getSource()).isEqualTo(Provenance.HEURISTIC);
    }

    @Test
    void resolve_shouldMoveOnWhenSourceFails() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenThrow(new IllegalStateException("bug"));
        when(heuristic.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune", 0.3, Provenance.HEURISTIC)));

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getField(CanonicalField.TITLE).getValue()).isEqualTo("Dune");
    }

    @Test
    void resolve_shouldAbandonSourceAfterTimeout() throws Exception {
        appProperties.getResolution().setAdapterTimeout(Duration.ofMillis(100));
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of(new FieldProposal(CanonicalField.TITLE, "Too Late", 0.9, Provenance.CATALOG_API));
        });
        when(heuristic.propose(any())).thenReturn(List.of(
                new FieldProposal(CanonicalField.TITLE, "Dune", 0.3, Provenance.HEURISTIC)));

        long start = System.nanoTime();
        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(4));
        assertThat(resolved.getField(CanonicalField.TITLE).getValue()).isEqualTo("Dune");
    }

    @Test
    void resolve_shouldLeaveFieldsUnresolvedWhenEverySourceIsExhausted() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder().build());
        when(catalog.propose(any())).thenReturn(List.of());
        when(heuristic.propose(any())).thenReturn(List.of());

        BookEntity resolved = resolver.resolve(BookEntity.pending(candidate()));

        assertThat(resolved.getFields().values()).allSatisfy(v -> assertThat(v.isResolved()).isFalse());
        assertThat(resolved.isComplete()).isFalse();
        verify(catalog, times(1)).propose(any());
        verify(heuristic, times(1)).propose(any());
    }

    @Test
    void resolve_shouldKeepStatusAndLeaveInputUntouched() throws Exception {
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder()
                .field(CanonicalField.TITLE, metadata("Dune"))
                .coverImagePath("/covers/dune.jpg")
                .build());
        when(catalog.propose(any())).thenReturn(List.of());
        when(heuristic.propose(any())).thenReturn(List.of());
        BookEntity approved = BookEntity.pending(candidate()).withStatus(ApprovalStatus.APPROVED);

        BookEntity resolved = resolver.resolve(approved);

        assertThat(resolved.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(resolved.getCoverImagePath()).isEqualTo("/covers/dune.jpg");
        assertThat(approved.getField(CanonicalField.TITLE).isResolved()).isFalse();
        assertThat(approved.getCoverImagePath()).isNull();
    }

    @Test
    void resolve_shouldNotReplaceConfidentValuesFromEarlierRun() throws Exception {
        BookEntity previous = BookEntity.pending(candidate()).toBuilder()
                .fields(Map.of(CanonicalField.TITLE, FieldValue.of("Dune", Provenance.CATALOG_API, 0.85)))
                .coverImagePath("/library/Frank Herbert/Dune/cover.jpg")
                .build();
        when(embeddedMetadataReader.read(any())).thenReturn(EmbeddedMetadata.builder()
                .field(CanonicalField.TITLE, metadata("Dune (Unabridged)"))
                .build());
        when(catalog.propose(any())).thenReturn(List.of());
        when(heuristic.propose(any())).thenReturn(List.of());

        BookEntity resolved = resolver.resolve(previous);

        assertThat(resolved.getField(CanonicalField.TITLE).getSource()).isEqualTo(Provenance.CATALOG_API);
        assertThat(resolved.getCoverImagePath()).isEqualTo("/library/Frank Herbert/Dune/cover.jpg");
    }

    private static FieldValue metadata(String value) {
        return FieldValue.of(value, Provenance.METADATA, 0.9);
    }

    private static BookCandidate candidate() {
        return BookCandidate.builder()
                .id("dune")
                .rootPath(DIR)
                .directory(DIR)
                .relativePath("Frank Herbert/Dune")
                .relativeDirectory("Frank Herbert/Dune")
                .file(DIR.resolve("01.mp3"))
                .file(DIR.resolve("02.mp3"))
                .pattern(FolderPattern.AUTHOR_FOLDER_BOOK)
                .build();
    }
}
