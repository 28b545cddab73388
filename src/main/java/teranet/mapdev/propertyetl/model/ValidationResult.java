package teranet.mapdev.propertyetl.model;

import lombok.Getter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one validation pass.
 *
 * {@code passed} is derived from the violation list only. The outlier count is
 * informational and never turns a pass into a failure.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ValidationResult {

    private final List<ViolationRecord> violations;
    private final long outlierCount;

    public ValidationResult(List<ViolationRecord> violations, long outlierCount) {
        this.violations = violations != null
                ? Collections.unmodifiableList(List.copyOf(violations))
                : Collections.emptyList();
        this.outlierCount = outlierCount;
    }

    public boolean isPassed() {
        return violations.isEmpty();
    }

    public int getViolationCount() {
        return violations.size();
    }
}
