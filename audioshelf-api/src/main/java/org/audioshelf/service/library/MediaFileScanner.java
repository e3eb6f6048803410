package org.audioshelf.service.library;

import lombok.extern.slf4j.Slf4j;
import org.audioshelf.model.dto.DirectoryListing;
import org.audioshelf.model.enums.MediaFileExtension;
import org.audioshelf.util.FileNameUtils;
import org.audioshelf.util.NaturalOrderComparator;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Walks a tree once and records, per directory, its audio files, loose images and child
 * directories that contain media somewhere below them.
 */
@Slf4j
@Component
public class MediaFileScanner {

    public Map<Path, DirectoryListing> scan(Path root) throws IOException {
        Map<Path, List<Path>> audioByDir = new HashMap<>();
        Map<Path, List<Path>> imagesByDir = new HashMap<>();
        Map<Path, List<Path>> childrenByDir = new HashMap<>();
        List<Path> directories = new ArrayList<>();

        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            @NonNull
            public FileVisitResult preVisitDirectory(@NonNull Path dir, @NonNull BasicFileAttributes attrs) {
                if (!dir.equals(root) && (FileNameUtils.isHidden(dir) || !Files.isReadable(dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                directories.add(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            @NonNull
            public FileVisitResult visitFile(@NonNull Path file, @NonNull BasicFileAttributes attrs) {
                if (FileNameUtils.isHidden(file) || !attrs.isRegularFile() || !Files.isReadable(file)) {
                    return FileVisitResult.CONTINUE;
                }
                String fileName = file.getFileName().toString();
                if (MediaFileExtension.isAudio(fileName)) {
                    audioByDir.computeIfAbsent(file.getParent(), k -> new ArrayList<>()).add(file);
                } else if (MediaFileExtension.isImage(fileName)) {
                    imagesByDir.computeIfAbsent(file.getParent(), k -> new ArrayList<>()).add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            @NonNull
            public FileVisitResult visitFileFailed(@NonNull Path file, @NonNull IOException e) {
                log.error("Failed read path [{}]: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            @Override
            @NonNull
            public FileVisitResult postVisitDirectory(@NonNull Path dir, IOException exc) {
                boolean hasMedia = audioByDir.containsKey(dir) || childrenByDir.containsKey(dir);
                if (hasMedia && !dir.equals(root)) {
                    childrenByDir.computeIfAbsent(dir.getParent(), k -> new ArrayList<>()).add(dir);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        Map<Path, DirectoryListing> listings = new TreeMap<>();
        for (Path dir : directories) {
            List<Path> audio = sorted(audioByDir.get(dir));
            List<Path> children = sorted(childrenByDir.get(dir));
            if (audio.isEmpty() && children.isEmpty() && !dir.equals(root)) {
                continue;
            }
            listings.put(dir, DirectoryListing.builder()
                    .directory(dir)
                    .audioFiles(audio)
                    .imageFiles(sorted(imagesByDir.get(dir)))
                    .subdirectories(children)
                    .build());
        }
        log.debug("Scanned {}: {} directories with media", root, listings.size());
        return listings;
    }

    private List<Path> sorted(List<Path> paths) {
        if (paths == null) {
            return List.of();
        }
        List<Path> copy = new ArrayList<>(paths);
        copy.sort(NaturalOrderComparator.BY_FILE_NAME);
        return copy;
    }
}
