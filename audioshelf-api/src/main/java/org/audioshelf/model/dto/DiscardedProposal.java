package org.audioshelf.model.dto;

import lombok.Value;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.Provenance;

/**
 * A proposal that lost to a stronger candidate for the same field, kept for audit.
 */
@Value
public class DiscardedProposal {
    CanonicalField field;
    String value;
    double confidence;
    Provenance source;
    String keptValue;
}
