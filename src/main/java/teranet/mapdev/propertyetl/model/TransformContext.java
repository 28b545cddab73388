package teranet.mapdev.propertyetl.model;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * State held for the duration of one transform run. Never persisted.
 */
@Value
public class TransformContext {

    /** Wall-clock time captured once at the start of the run */
    LocalDateTime runStartedAt;

    /**
     * Violations reported by the validation pass that preceded this run.
     * Steps only read them for logging; they never change what a step does.
     */
    List<ViolationRecord> precedingViolations;

    public static TransformContext startingAt(LocalDateTime runStartedAt) {
        return new TransformContext(runStartedAt, List.of());
    }

    /**
     * Total count of preceding violations of one type on one column, 0 when none were reported.
     */
    public long precedingCount(ViolationRecord.ViolationType type, String column) {
        long total = 0;
        for (ViolationRecord violation : precedingViolations) {
            if (violation.getType() == type && violation.getColumn().equals(column)) {
                total += violation.getCount();
            }
        }
        return total;
    }
}
