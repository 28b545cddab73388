package teranet.mapdev.propertyetl.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One data-quality defect class detected by a validation pass.
 * Descriptive only: it carries no severity and never blocks processing.
 */
@Value
@AllArgsConstructor
public class ViolationRecord {

    public enum ViolationType {
        CRITICAL_NULLS, // Missing values in a critical column
        NEGATIVE_PRICE, // Price below zero
        DUPLICATE_KEY // Listing id repeated after its first occurrence
    }

    ViolationType type;

    /** Column the defect was found in */
    String column;

    /** Number of offending records */
    long count;

    String description;

    public static ViolationRecord criticalNulls(String column, long count) {
        return new ViolationRecord(ViolationType.CRITICAL_NULLS, column, count,
                String.format("Column '%s': %d null values found", column, count));
    }

    public static ViolationRecord negativePrices(String column, long count) {
        return new ViolationRecord(ViolationType.NEGATIVE_PRICE, column, count,
                String.format("Negative prices found: %d", count));
    }

    public static ViolationRecord duplicateKeys(String column, long count) {
        return new ViolationRecord(ViolationType.DUPLICATE_KEY, column, count,
                String.format("Duplicate records found: %d", count));
    }

    @JsonValue
    @Override
    public String toString() {
        return description;
    }
}
