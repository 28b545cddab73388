package teranet.mapdev.propertyetl.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.TransformContext;
import teranet.mapdev.propertyetl.model.ViolationRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the first record for each key and drops every later one, preserving
 * the relative order of kept records. Missing keys compare equal to each other.
 */
@Slf4j
public class DeduplicationTransformer implements DatasetTransformer {

    private final String keyColumn;

    public DeduplicationTransformer(String keyColumn) {
        this.keyColumn = keyColumn;
    }

    @Override
    public String getName() {
        return "deduplication[" + keyColumn + "]";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(keyColumn);
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        Set<Object> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>();
        List<Object> keys = dataset.getColumnValues(keyColumn);
        for (int i = 0; i < keys.size(); i++) {
            if (seen.add(keys.get(i))) {
                kept.add(i);
            }
        }

        int removed = dataset.size() - kept.size();
        if (removed > 0) {
            log.debug("Removed {} duplicate records on '{}'", removed, keyColumn);
        }

        // Raw ids were validated before text normalization, so the counts can differ
        long reported = context.precedingCount(ViolationRecord.ViolationType.DUPLICATE_KEY, keyColumn);
        if (reported != removed) {
            log.info("Validation reported {} duplicates on '{}', deduplication removed {}",
                    reported, keyColumn, removed);
        }
        return dataset.selectRows(kept);
    }
}
