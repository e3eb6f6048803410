package org.audioshelf.service.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.exception.ExtractionException;
import org.audioshelf.model.dto.AudioTags;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.EmbeddedMetadata;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.source.heuristic.NameParse;
import org.audioshelf.service.source.heuristic.NamePatterns;
import org.audioshelf.util.FileNameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads the tags of every member file of a candidate and folds them into one value per field.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddedMetadataReader {

    private final AudioTagReader audioTagReader;
    private final AppProperties appProperties;

    public EmbeddedMetadata read(BookCandidate candidate) {
        EmbeddedMetadata.EmbeddedMetadataBuilder result = EmbeddedMetadata.builder();
        List<AudioTags> tags = new ArrayList<>();
        for (Path file : candidate.getFiles()) {
            try {
                tags.add(audioTagReader.read(file));
            } catch (ExtractionException e) {
                log.warn("Skipping tags of {}: {}", e.getFile(), e.getMessage());
                result.failedFile(file);
            }
        }

        double confidence = appProperties.getResolution().getMetadataConfidence();
        boolean singleMember = candidate.getFiles().size() == 1;

        String author = majority(tags, AudioTags::getAuthor);
        String series = majority(tags, AudioTags::getSeries);
        String album = majority(tags, AudioTags::getAlbum);
        String trackTitle = singleMember ? majority(tags, AudioTags::getTitle) : unanimous(tags, AudioTags::getTitle);

        Optional<NameParse> albumParse = Optional.ofNullable(album).flatMap(NamePatterns::parse);
        Integer seriesIndex = null;
        if (series == null && albumParse.map(NameParse::hasSeries).orElse(false)) {
            series = albumParse.get().series();
            seriesIndex = albumParse.get().index();
        } else if (series != null && albumParse.isPresent() && series.equalsIgnoreCase(albumParse.get().series())) {
            seriesIndex = albumParse.get().index();
        }
        if (seriesIndex == null && series != null && singleMember) {
            seriesIndex = tags.stream().map(AudioTags::getTrack).filter(Objects::nonNull).findFirst().orElse(null);
        }

        String title = album;
        if (albumParse.map(NameParse::hasSeries).orElse(false)) {
            // album carries the series; a title part of it wins, then the track title
            title = albumParse.get().title() != null ? albumParse.get().title() : trackTitle;
        } else if (title == null) {
            title = trackTitle;
        }
        title = NamePatterns.stripSeriesSuffix(title, series);

        put(result, CanonicalField.AUTHOR, author, confidence);
        put(result, CanonicalField.SERIES, series, confidence);
        put(result, CanonicalField.SERIES_INDEX, seriesIndex == null ? null : String.valueOf(seriesIndex), confidence);
        if (title != null) {
            put(result, CanonicalField.TITLE, title, confidence);
        } else if (!tags.isEmpty() && isFolderLevel(candidate)) {
            result.field(CanonicalField.TITLE, FieldValue.of(FileNameUtils.cleanFragment(FileNameUtils.folderName(candidate.getDirectory())),
                    Provenance.HEURISTIC, appProperties.getGrouping().getFolderHintConfidence()));
        }

        result.coverImagePath(chooseCover(candidate, tags));
        return result.build();
    }

    private boolean isFolderLevel(BookCandidate candidate) {
        return candidate.getRootPath() != null && candidate.getRootPath().equals(candidate.getDirectory())
                && candidate.getPattern() != FolderPattern.MULTI_BOOK_FOLDER;
    }

    private void put(EmbeddedMetadata.EmbeddedMetadataBuilder result, CanonicalField field, String value, double confidence) {
        FieldValue fieldValue = FieldValue.of(value, Provenance.METADATA, confidence);
        if (fieldValue.isResolved()) {
            result.field(field, fieldValue);
        }
    }

    /**
     * Most frequent non-blank value, compared case-insensitively; ties go to the value seen first.
     */
    private String majority(List<AudioTags> tags, Function<AudioTags, String> getter) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> spelling = new LinkedHashMap<>();
        for (AudioTags tag : tags) {
            String value = getter.apply(tag);
            if (StringUtils.isBlank(value)) {
                continue;
            }
            String key = value.trim().toLowerCase(Locale.ROOT);
            counts.merge(key, 1, Integer::sum);
            spelling.putIfAbsent(key, value.trim());
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? null : spelling.get(best);
    }

    /**
     * Value shared by every tagged member, or {@code null}. Per-chapter titles are not a book title.
     */
    private String unanimous(List<AudioTags> tags, Function<AudioTags, String> getter) {
        List<String> values = tags.stream().map(getter).filter(StringUtils::isNotBlank).map(String::trim).distinct().toList();
        return values.size() == 1 ? values.get(0) : null;
    }

    private String chooseCover(BookCandidate candidate, List<AudioTags> tags) {
        Optional<AudioTags> withArtwork = tags.stream().filter(AudioTags::hasArtwork).findFirst();
        if (withArtwork.isPresent()) {
            try {
                return writeEmbeddedCover(candidate.getId(), withArtwork.get()).toString();
            } catch (IOException e) {
                log.warn("Failed to write embedded cover for {}: {}", candidate.getRelativePath(), e.getMessage());
            }
        }
        return chooseLooseImage(candidate).map(Path::toString).orElse(null);
    }

    private Path writeEmbeddedCover(String id, AudioTags tags) throws IOException {
        Path coverDir = Path.of(appProperties.getCoverDir()).toAbsolutePath().normalize();
        Files.createDirectories(coverDir);
        Path target = coverDir.resolve(id + "." + imageExtension(tags.getArtworkMimeType()));
        Files.write(target, tags.getArtwork());
        return target;
    }

    private String imageExtension(String mimeType) {
        if (mimeType == null) {
            return "jpg";
        }
        String lower = mimeType.toLowerCase(Locale.ROOT);
        if (lower.contains("png")) {
            return "png";
        }
        if (lower.contains("webp")) {
            return "webp";
        }
        return "jpg";
    }

    /**
     * A loose image named like a cover or like the folder, else the first image by name.
     */
    Optional<Path> chooseLooseImage(BookCandidate candidate) {
        List<Path> images = candidate.getAuxiliaryFiles();
        if (images.isEmpty()) {
            return Optional.empty();
        }
        String folderKey = FileNameUtils.groupingKey(FileNameUtils.folderName(candidate.getDirectory()));
        return images.stream()
                .filter(image -> {
                    String key = FileNameUtils.groupingKey(image.getFileName().toString());
                    return key.contains("cover") || (!folderKey.isEmpty() && key.equals(folderKey));
                })
                .findFirst()
                .or(() -> Optional.of(images.get(0)));
    }
}
