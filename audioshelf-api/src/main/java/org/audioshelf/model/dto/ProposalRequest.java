package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.audioshelf.model.enums.CanonicalField;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a source adapter is asked: the fields still missing, the values known so far and the raw
 * file/folder names.
 */
@Value
@Builder(toBuilder = true)
public class ProposalRequest {

    BookCandidate candidate;

    @Singular
    Map<CanonicalField, String> knownFields;

    @Singular
    List<String> rawTextHints;

    Set<CanonicalField> requestedFields;

    public String known(CanonicalField field) {
        return knownFields.get(field);
    }

    public boolean wants(CanonicalField field) {
        return requestedFields.contains(field);
    }

    /**
     * Known value of a field, else the folder-derived hint of the candidate, else {@code null}.
     */
    public String knownOrHint(CanonicalField field) {
        String value = known(field);
        if (value != null) {
            return value;
        }
        FieldValue hint = candidate.getFolderHints().get(field);
        return hint != null && hint.isResolved() ? hint.getValue() : null;
    }
}
