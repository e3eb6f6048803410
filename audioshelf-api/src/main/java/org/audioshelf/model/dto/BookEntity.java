package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.CanonicalField;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A candidate with its four canonical fields, cover reference and approval status. Immutable:
 * resolution and approval each produce a new instance.
 */
@Value
@Builder(toBuilder = true)
public class BookEntity {

    BookCandidate candidate;

    Map<CanonicalField, FieldValue> fields;

    String coverImagePath;

    @With
    ApprovalStatus status;

    @Singular
    List<DiscardedProposal> discardedProposals;

    public static BookEntity pending(BookCandidate candidate) {
        return BookEntity.builder()
                .candidate(candidate)
                .fields(emptyFields())
                .status(ApprovalStatus.PENDING)
                .build();
    }

    public static Map<CanonicalField, FieldValue> emptyFields() {
        Map<CanonicalField, FieldValue> fields = new EnumMap<>(CanonicalField.class);
        Arrays.stream(CanonicalField.values()).forEach(f -> fields.put(f, FieldValue.unresolved()));
        return fields;
    }

    public String getId() {
        return candidate.getId();
    }

    public FieldValue getField(CanonicalField field) {
        FieldValue value = fields == null ? null : fields.get(field);
        return value != null ? value : FieldValue.unresolved();
    }

    public Map<CanonicalField, FieldValue> getFields() {
        Map<CanonicalField, FieldValue> all = emptyFields();
        if (fields != null) {
            all.putAll(fields);
        }
        return Collections.unmodifiableMap(all);
    }

    public boolean isComplete() {
        return getField(CanonicalField.AUTHOR).isResolved() && getField(CanonicalField.TITLE).isResolved();
    }
}
