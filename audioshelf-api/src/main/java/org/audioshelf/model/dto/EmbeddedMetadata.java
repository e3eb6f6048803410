package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.audioshelf.model.enums.CanonicalField;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of reading every member file of a candidate.
 */
@Value
@Builder
public class EmbeddedMetadata {

    @Singular
    Map<CanonicalField, FieldValue> fields;

    String coverImagePath;

    @Singular
    List<Path> failedFiles;

    public FieldValue get(CanonicalField field) {
        return fields.getOrDefault(field, FieldValue.unresolved());
    }
}
