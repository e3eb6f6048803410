package org.audioshelf.mapper;

import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.DiscardedProposal;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.dto.store.BookEntityRecord;
import org.audioshelf.model.dto.store.FieldRecord;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.model.enums.Provenance;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BookEntityMapperTest {

    private final BookEntityMapper mapper = Mappers.getMapper(BookEntityMapper.class);

    @Test
    void toRecord_shouldFlattenCandidateAndFields() {
        Path file = Path.of("/library/The Bladeborn Saga/Book 2 - Ghost of the Shadowfort.m4b");
        BookEntity entity = BookEntity.builder()
                .candidate(BookCandidate.builder()
                        .id("abc")
                        .rootPath(file)
                        .directory(file.getParent())
                        .relativePath("The Bladeborn Saga/Book 2 - Ghost of the Shadowfort.m4b")
                        .relativeDirectory("The Bladeborn Saga")
                        .file(file)
                        .pattern(FolderPattern.MULTI_BOOK_FOLDER)
                        .build())
                .fields(Map.of(
                        CanonicalField.SERIES_INDEX, FieldValue.of("2", Provenance.HEURISTIC, 0.3),
                        CanonicalField.TITLE, FieldValue.of("Ghost of the Shadowfort", Provenance.HEURISTIC, 0.3)))
                .status(ApprovalStatus.APPROVED)
                .discardedProposal(new DiscardedProposal(CanonicalField.TITLE, "Ghost", 0.2, Provenance.WEB_SEARCH, "Ghost of the Shadowfort"))
                .build();

        BookEntityRecord record = mapper.toRecord(entity);

        assertThat(record.getId()).isEqualTo("abc");
        assertThat(record.getSourcePath()).isEqualTo(file.toString());
        assertThat(record.getFiles()).containsExactly(file.toString());
        assertThat(record.getPattern()).isEqualTo(FolderPattern.MULTI_BOOK_FOLDER);
        assertThat(record.getSeriesIndex().getValue()).isEqualTo(2);
        assertThat(record.getTitle().getValue()).isEqualTo("Ghost of the Shadowfort");
        assertThat(record.getAuthor().getValue()).isEqualTo("");
        assertThat(record.getAuthor().getSource()).isEqualTo(Provenance.UNRESOLVED);
        assertThat(record.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(record.isComplete()).isFalse();
        assertThat(record.getDiscardedProposals()).hasSize(1);
    }

    @Test
    void toEntity_shouldRebuildFileLevelCandidate() {
        BookEntityRecord record = BookEntityRecord.builder()
                .id("abc")
                .sourcePath("/library/Saga/Book 1.m4b")
                .relativePath("Saga/Book 1.m4b")
                .pattern(FolderPattern.MULTI_BOOK_FOLDER)
                .files(List.of("/library/Saga/Book 1.m4b"))
                .author(FieldRecord.builder().value("Frank Herbert").source(Provenance.CATALOG_API).confidence(0.8).build())
                .seriesIndex(FieldRecord.builder().value(1).source(Provenance.HEURISTIC).confidence(0.3).build())
                .build();

        BookEntity entity = mapper.toEntity(record);

        assertThat(entity.getCandidate().getDirectory()).isEqualTo(Path.of("/library/Saga"));
        assertThat(entity.getCandidate().getRelativeDirectory()).isEqualTo("Saga");
        assertThat(entity.getField(CanonicalField.AUTHOR)).isEqualTo(FieldValue.of("Frank Herbert", Provenance.CATALOG_API, 0.8));
        assertThat(entity.getField(CanonicalField.SERIES_INDEX).asInteger()).isEqualTo(1);
        assertThat(entity.getField(CanonicalField.TITLE).isResolved()).isFalse();
        assertThat(entity.getStatus()).isEqualTo(ApprovalStatus.PENDING);
    }

    @Test
    void toEntity_shouldRebuildFolderLevelCandidate() {
        BookEntityRecord record = BookEntityRecord.builder()
                .id("dune")
                .sourcePath("/library/Frank Herbert/Dune")
                .relativePath("Frank Herbert/Dune")
                .pattern(FolderPattern.AUTHOR_FOLDER_BOOK)
                .files(List.of("/library/Frank Herbert/Dune/01.mp3", "/library/Frank Herbert/Dune/02.mp3"))
                .status(ApprovalStatus.REJECTED)
                .build();

        BookEntity entity = mapper.toEntity(record);

        assertThat(entity.getCandidate().getDirectory()).isEqualTo(Path.of("/library/Frank Herbert/Dune"));
        assertThat(entity.getCandidate().getRelativeDirectory()).isEqualTo("Frank Herbert/Dune");
        assertThat(entity.getCandidate().getFiles()).hasSize(2);
        assertThat(entity.getStatus()).isEqualTo(ApprovalStatus.REJECTED);
    }

    @Test
    void toEntity_shouldRebuildBookScannedAsRoot() {
        BookEntityRecord record = BookEntityRecord.builder()
                .id("root")
                .sourcePath("/library/Dune")
                .relativePath(".")
                .pattern(FolderPattern.CHAPTERED_FOLDER)
                .files(List.of("/library/Dune/Dune - 01.mp3", "/library/Dune/Dune - 02.mp3"))
                .build();

        BookEntity entity = mapper.toEntity(record);

        assertThat(entity.getCandidate().getDirectory()).isEqualTo(Path.of("/library/Dune"));
        assertThat(entity.getCandidate().getRelativeDirectory()).isEmpty();
    }
}
