package org.audioshelf.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum CanonicalField {
    AUTHOR("author"),
    SERIES("series"),
    SERIES_INDEX("series_index"),
    TITLE("title");

    @JsonValue
    private final String key;
}
