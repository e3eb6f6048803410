package org.audioshelf.model.dto;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.model.enums.Provenance;

/**
 * One resolved canonical field. An unresolved field still has a value object: empty value,
 * {@link Provenance#UNRESOLVED}, zero confidence.
 */
@Value
public class FieldValue {

    private static final FieldValue UNRESOLVED = new FieldValue("", Provenance.UNRESOLVED, 0.0);

    String value;
    Provenance source;
    double confidence;

    public static FieldValue unresolved() {
        return UNRESOLVED;
    }

    public static FieldValue of(String value, Provenance source, double confidence) {
        if (StringUtils.isBlank(value) || source == Provenance.UNRESOLVED) {
            return UNRESOLVED;
        }
        return new FieldValue(value.trim(), source, Math.max(0.0, Math.min(1.0, confidence)));
    }

    public boolean isResolved() {
        return source != Provenance.UNRESOLVED && StringUtils.isNotBlank(value);
    }

    public boolean isResolvedAtLeast(double threshold) {
        return isResolved() && confidence >= threshold;
    }

    /**
     * Series index as an integer, or {@code null} when the value is empty or not numeric.
     */
    public Integer asInteger() {
        if (!isResolved()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
