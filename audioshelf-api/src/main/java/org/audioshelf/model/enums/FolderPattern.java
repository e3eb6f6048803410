package org.audioshelf.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@RequiredArgsConstructor
@Getter
public enum FolderPattern {
    SINGLE_FILE("SingleFile"),
    CHAPTERED_FOLDER("ChapteredFolder"),
    MULTI_BOOK_FOLDER("MultiBookFolder"),
    AUTHOR_FOLDER_BOOK("AuthorFolder>Book");

    @JsonValue
    private final String label;

    @JsonCreator
    public static FolderPattern fromLabel(String label) {
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(label) || p.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown folder pattern: " + label));
    }
}
