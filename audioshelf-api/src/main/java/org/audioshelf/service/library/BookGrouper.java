package org.audioshelf.service.library;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.DirectoryListing;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.util.EntityIds;
import org.audioshelf.util.FileNameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions the audio files under a root into book candidates. Every audio file ends up in
 * exactly one candidate; loose images are attached as auxiliary files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookGrouper {

    private static final int MIN_IMAGE_KEY_LENGTH = 3;

    private final MediaFileScanner mediaFileScanner;
    private final FolderClassifier folderClassifier;
    private final AppProperties appProperties;

    public List<BookCandidate> group(Path root) throws IOException {
        Path scanRoot = root.toAbsolutePath().normalize();
        Map<Path, DirectoryListing> tree = mediaFileScanner.scan(scanRoot);
        List<BookCandidate> candidates = new ArrayList<>();
        visit(scanRoot, scanRoot, tree, FolderContext.NONE, candidates);
        log.info("Grouped {} book candidates under {}", candidates.size(), scanRoot);
        return candidates;
    }

    private void visit(Path scanRoot, Path dir, Map<Path, DirectoryListing> tree, FolderContext context, List<BookCandidate> out) {
        DirectoryListing listing = tree.get(dir);
        if (listing == null) {
            return;
        }
        boolean isScanRoot = dir.equals(scanRoot);
        Optional<FolderClassification> classification = folderClassifier.classify(listing, tree, isScanRoot);

        if (classification.isEmpty()) {
            FolderContext containerContext = isScanRoot ? FolderContext.NONE : context.insideContainer(FileNameUtils.folderName(dir));
            listing.getSubdirectories().forEach(sub -> visit(scanRoot, sub, tree, containerContext, out));
            return;
        }

        FolderClassification folder = classification.get();
        if (folder.isAuthorFolder()) {
            FolderContext authorContext = context.containerName() != null
                    ? FolderContext.authorFolder(context.containerName(), FileNameUtils.folderName(dir))
                    : FolderContext.authorFolder(FileNameUtils.folderName(dir), null);
            log.debug("{}: author folder (author hint '{}', series hint '{}')", dir, authorContext.author(), authorContext.series());
            listing.getSubdirectories().forEach(sub -> visit(scanRoot, sub, tree, authorContext, out));
            return;
        }

        boolean spansChildren = !listing.hasAudio();
        List<Path> images = new ArrayList<>(listing.getImageFiles());
        if (spansChildren) {
            listing.getSubdirectories().stream()
                    .map(tree::get)
                    .forEach(child -> images.addAll(child.getImageFiles()));
        }

        List<BookCandidate> built = new ArrayList<>();
        for (List<Path> work : folder.works()) {
            built.add(buildCandidate(scanRoot, dir, work, folder, context, isScanRoot));
        }
        out.addAll(attachImages(built, images, !isScanRoot || built.size() == 1));

        if (!spansChildren) {
            FolderContext nested = context.withoutContainer();
            listing.getSubdirectories().forEach(sub -> visit(scanRoot, sub, tree, nested, out));
        }
    }

    private BookCandidate buildCandidate(Path scanRoot, Path dir, List<Path> work, FolderClassification folder,
                                         FolderContext context, boolean isScanRoot) {
        // a chaptered book scanned directly is the root folder itself
        boolean folderLevel = folder.pattern() == FolderPattern.CHAPTERED_FOLDER
                || (!isScanRoot && folder.pattern() != FolderPattern.MULTI_BOOK_FOLDER);
        Path rootPath = folderLevel ? dir : work.get(0);
        String relativePath = FileNameUtils.relativePath(scanRoot, rootPath);
        String relativeDirectory = isScanRoot ? "" : FileNameUtils.relativePath(scanRoot, dir);

        FolderPattern pattern = folder.pattern();
        if (context.underAuthorFolder() && pattern != FolderPattern.MULTI_BOOK_FOLDER) {
            pattern = FolderPattern.AUTHOR_FOLDER_BOOK;
        }

        BookCandidate.BookCandidateBuilder builder = BookCandidate.builder()
                .id(EntityIds.fromRelativePath(relativePath))
                .rootPath(rootPath)
                .directory(dir)
                .relativePath(relativePath)
                .relativeDirectory(relativeDirectory)
                .files(work)
                .pattern(pattern)
                .confidence(folder.confidence());

        double hintConfidence = appProperties.getGrouping().getFolderHintConfidence();
        String folderName = FileNameUtils.cleanFragment(FileNameUtils.folderName(dir));
        if (context.author() != null) {
            builder.folderHint(CanonicalField.AUTHOR, hint(context.author(), hintConfidence));
        }
        if (folder.pattern() == FolderPattern.MULTI_BOOK_FOLDER) {
            boolean numbered = folder.works().stream()
                    .flatMap(List::stream)
                    .anyMatch(f -> StringUtils.containsAny(FileNameUtils.stem(f), "0123456789"));
            if (numbered && !folderName.isEmpty()) {
                builder.folderHint(CanonicalField.SERIES, hint(folderName, hintConfidence));
            } else if (context.series() != null) {
                builder.folderHint(CanonicalField.SERIES, hint(context.series(), hintConfidence));
            }
        } else {
            if (context.series() != null) {
                builder.folderHint(CanonicalField.SERIES, hint(context.series(), hintConfidence));
            }
            if (folderLevel && !folderName.isEmpty()) {
                builder.folderHint(CanonicalField.TITLE, hint(folderName, hintConfidence));
            }
        }
        return builder.build();
    }

    private FieldValue hint(String value, double confidence) {
        return FieldValue.of(FileNameUtils.cleanFragment(value), Provenance.HEURISTIC, confidence);
    }

    /**
     * Images named after one work go to that work. Remaining images are shared by every work of
     * the directory when {@code shareUnmatched} is set, and dropped otherwise.
     */
    private List<BookCandidate> attachImages(List<BookCandidate> candidates, List<Path> images, boolean shareUnmatched) {
        if (images.isEmpty() || candidates.isEmpty()) {
            return candidates;
        }
        List<BookCandidate.BookCandidateBuilder> builders = candidates.stream().map(BookCandidate::toBuilder).toList();
        for (Path image : images) {
            String imageKey = FileNameUtils.groupingKey(image.getFileName().toString());
            boolean matched = false;
            if (candidates.size() > 1 && imageKey.length() >= MIN_IMAGE_KEY_LENGTH) {
                for (int i = 0; i < candidates.size(); i++) {
                    String workKey = FileNameUtils.stripTrailingOrdinal(
                            FileNameUtils.groupingKey(candidates.get(i).getPrimaryFile().getFileName().toString()));
                    if (imageKey.equals(workKey) || imageKey.contains(workKey) || workKey.contains(imageKey)) {
                        builders.get(i).auxiliaryFile(image);
                        matched = true;
                        break;
                    }
                }
            }
            if (!matched && shareUnmatched) {
                builders.forEach(b -> b.auxiliaryFile(image));
            }
        }
        return builders.stream().map(BookCandidate.BookCandidateBuilder::build).toList();
    }

    /**
     * Hints inherited from enclosing folders while walking down.
     */
    private record FolderContext(String author, String series, boolean underAuthorFolder, String containerName) {

        static final FolderContext NONE = new FolderContext(null, null, false, null);

        static FolderContext authorFolder(String author, String series) {
            return new FolderContext(author, series, true, null);
        }

        FolderContext insideContainer(String name) {
            return new FolderContext(author, series, false, name);
        }

        FolderContext withoutContainer() {
            return new FolderContext(author, series, false, null);
        }
    }
}
