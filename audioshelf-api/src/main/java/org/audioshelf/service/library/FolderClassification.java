package org.audioshelf.service.library;

import org.audioshelf.model.enums.FolderPattern;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of classifying one directory. {@code works} lists the audio files of each work found
 * directly in the directory (or, for a disc layout, across its child folders); it is empty for an
 * author folder, whose books are classified one level down.
 */
public record FolderClassification(FolderPattern pattern, List<List<Path>> works, double confidence) {

    public static FolderClassification authorFolder(double confidence) {
        return new FolderClassification(FolderPattern.AUTHOR_FOLDER_BOOK, List.of(), confidence);
    }

    public boolean isAuthorFolder() {
        return pattern == FolderPattern.AUTHOR_FOLDER_BOOK && works.isEmpty();
    }
}
