package org.audioshelf.model.dto;

import lombok.Value;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.Provenance;

@Value
public class FieldProposal {
    CanonicalField field;
    String value;
    double confidence;
    Provenance source;
}
