package org.audioshelf.mapper;

import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.dto.store.BookEntityRecord;
import org.audioshelf.model.dto.store.FieldRecord;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.CanonicalField;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Mapper(componentModel = "spring")
public interface BookEntityMapper {

    @Mapping(source = "candidate.id", target = "id")
    @Mapping(source = "candidate.rootPath", target = "sourcePath")
    @Mapping(source = "candidate.relativePath", target = "relativePath")
    @Mapping(source = "candidate.pattern", target = "pattern")
    @Mapping(source = "candidate.files", target = "files")
    @Mapping(source = ".", target = "author", qualifiedByName = "mapAuthor")
    @Mapping(source = ".", target = "series", qualifiedByName = "mapSeries")
    @Mapping(source = ".", target = "seriesIndex", qualifiedByName = "mapSeriesIndex")
    @Mapping(source = ".", target = "title", qualifiedByName = "mapTitle")
    BookEntityRecord toRecord(BookEntity entity);

    List<BookEntityRecord> toRecords(List<BookEntity> entities);

    default String mapPath(Path path) {
        return path == null ? null : path.toString();
    }

    @Named("mapAuthor")
    default FieldRecord mapAuthor(BookEntity entity) {
        return FieldRecord.from(entity.getField(CanonicalField.AUTHOR), false);
    }

    @Named("mapSeries")
    default FieldRecord mapSeries(BookEntity entity) {
        return FieldRecord.from(entity.getField(CanonicalField.SERIES), false);
    }

    @Named("mapSeriesIndex")
    default FieldRecord mapSeriesIndex(BookEntity entity) {
        return FieldRecord.from(entity.getField(CanonicalField.SERIES_INDEX), true);
    }

    @Named("mapTitle")
    default FieldRecord mapTitle(BookEntity entity) {
        return FieldRecord.from(entity.getField(CanonicalField.TITLE), false);
    }

    /**
     * Rebuilds an entity from its persisted record. Folder hints and auxiliary files are not
     * persisted and come back empty until the next scan.
     */
    default BookEntity toEntity(BookEntityRecord record) {
        List<Path> files = record.getFiles() == null ? List.of() : record.getFiles().stream().map(Path::of).toList();
        Path rootPath = record.getSourcePath() == null ? null : Path.of(record.getSourcePath());
        boolean fileLevel = rootPath != null && files.size() == 1 && files.get(0).equals(rootPath);
        Path directory = fileLevel ? rootPath.getParent() : rootPath;

        String relativePath = record.getRelativePath();
        // "." is a book scanned as the root itself
        String relativeDirectory = ".".equals(relativePath) ? "" : relativePath;
        if (relativePath != null && fileLevel) {
            int slash = relativePath.lastIndexOf('/');
            relativeDirectory = slash < 0 ? "" : relativePath.substring(0, slash);
        }

        BookCandidate candidate = BookCandidate.builder()
                .id(record.getId())
                .rootPath(rootPath)
                .directory(directory)
                .relativePath(relativePath)
                .relativeDirectory(relativeDirectory)
                .files(files)
                .pattern(record.getPattern())
                .build();

        Map<CanonicalField, FieldValue> fields = new EnumMap<>(CanonicalField.class);
        fields.put(CanonicalField.AUTHOR, FieldRecord.toFieldValue(record.getAuthor()));
        fields.put(CanonicalField.SERIES, FieldRecord.toFieldValue(record.getSeries()));
        fields.put(CanonicalField.SERIES_INDEX, FieldRecord.toFieldValue(record.getSeriesIndex()));
        fields.put(CanonicalField.TITLE, FieldRecord.toFieldValue(record.getTitle()));

        return BookEntity.builder()
                .candidate(candidate)
                .fields(fields)
                .coverImagePath(record.getCoverImagePath())
                .status(record.getStatus() == null ? ApprovalStatus.PENDING : record.getStatus())
                .build();
    }
}
