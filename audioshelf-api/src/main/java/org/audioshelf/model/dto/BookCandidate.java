package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A group of audio files believed to form one book, before any field resolution.
 */
@Value
@Builder(toBuilder = true)
public class BookCandidate {

    String id;

    /**
     * Directory for folder-level candidates, first member file for file-level ones.
     */
    Path rootPath;

    Path directory;

    /**
     * {@link #rootPath} relative to the scanned root, '/' separated. The id is derived from it.
     */
    String relativePath;

    /**
     * Folder holding the member files relative to the scanned root; empty for the root itself.
     */
    String relativeDirectory;

    @Singular
    List<Path> files;

    @Singular("auxiliaryFile")
    List<Path> auxiliaryFiles;

    FolderPattern pattern;

    double confidence;

    /**
     * Low-confidence values read off the folder layout (author folder name, series folder name).
     */
    @Singular
    Map<CanonicalField, FieldValue> folderHints;

    public Path getPrimaryFile() {
        return files.isEmpty() ? null : files.get(0);
    }

    /**
     * Relative folder followed by the indented member file names.
     */
    public String describeStructure() {
        StringBuilder structure = new StringBuilder();
        String folder = relativeDirectory == null ? "" : relativeDirectory;
        if (!folder.isEmpty()) {
            structure.append(folder).append('\n');
        }
        for (Path file : files) {
            structure.append(folder.isEmpty() ? "" : "  ").append(file.getFileName()).append('\n');
        }
        return structure.toString().stripTrailing();
    }
}
