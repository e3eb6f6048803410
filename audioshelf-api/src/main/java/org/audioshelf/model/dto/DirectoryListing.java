package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Media found directly inside one directory. Lists are in natural file-name order.
 */
@Value
@Builder
public class DirectoryListing {

    Path directory;

    @Singular
    List<Path> audioFiles;

    @Singular
    List<Path> imageFiles;

    @Singular
    List<Path> subdirectories;

    public boolean hasAudio() {
        return !audioFiles.isEmpty();
    }
}
