package org.audioshelf.model.dto.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.enums.Provenance;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class FieldRecord {
    /**
     * String for text fields, integer for the series index, empty string when unresolved.
     */
    private Object value;
    private Provenance source;
    private double confidence;

    public static FieldRecord from(FieldValue value, boolean integer) {
        Object stored = value.getValue();
        if (integer && value.asInteger() != null) {
            stored = value.asInteger();
        }
        return FieldRecord.builder()
                .value(stored)
                .source(value.getSource())
                .confidence(value.getConfidence())
                .build();
    }

    public static FieldValue toFieldValue(FieldRecord record) {
        if (record == null || record.getValue() == null || record.getSource() == null) {
            return FieldValue.unresolved();
        }
        return FieldValue.of(String.valueOf(record.getValue()), record.getSource(), record.getConfidence());
    }
}
