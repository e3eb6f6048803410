package org.audioshelf.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Which source produced a field value. Declaration order is the cascade order.
 */
@RequiredArgsConstructor
@Getter
public enum Provenance {
    METADATA("metadata"),
    CATALOG_API("catalog_api"),
    LANGUAGE_MODEL("language_model"),
    WEB_SEARCH("web_search"),
    HEURISTIC("heuristic"),
    UNRESOLVED("unresolved");

    @JsonValue
    private final String tag;

    @JsonCreator
    public static Provenance fromTag(String tag) {
        return Arrays.stream(values())
                .filter(p -> p.tag.equalsIgnoreCase(tag))
                .findFirst()
                .orElse(UNRESOLVED);
    }
}
