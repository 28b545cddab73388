package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.ValidationResult;
import teranet.mapdev.propertyetl.model.ViolationRecord;
import teranet.mapdev.propertyetl.transformer.TransformerUtils;
import teranet.mapdev.propertyetl.util.StatisticsUtil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a dataset snapshot against the listing data-quality rules.
 *
 * Rules, each evaluated independently over the dataset as given:
 * - Critical nulls: missing values in id_propiedad, precio, tipo_propiedad
 * - Negative prices
 * - Price outliers by the 1.5 x IQR rule (logged only, never a violation)
 * - Duplicate listing ids after their first occurrence
 *
 * Validation never changes the dataset and never blocks the pipeline. The
 * service is stateless: every call returns a fresh {@link ValidationResult}.
 */
@Service
@Slf4j
public class DataQualityValidator {

    /**
     * Validate the dataset.
     *
     * @param dataset dataset to inspect
     * @return violations found and the informational outlier count
     */
    public ValidationResult validate(Dataset dataset) {
        log.info("Starting data quality validation on {} records", dataset.size());

        List<ViolationRecord> violations = new ArrayList<>();
        violations.addAll(checkCriticalNulls(dataset));

        long outliers = 0;
        if (dataset.hasColumn(ListingColumns.PRICE)) {
            List<Double> prices = numericValues(dataset, ListingColumns.PRICE);

            long negativePrices = prices.stream().filter(price -> price < 0).count();
            if (negativePrices > 0) {
                violations.add(ViolationRecord.negativePrices(ListingColumns.PRICE, negativePrices));
            }

            outliers = StatisticsUtil.countIqrOutliers(prices);
            if (outliers > 0) {
                log.warn("Possible price outliers detected: {}", outliers);
            }
        }

        if (dataset.hasColumn(ListingColumns.ID)) {
            long duplicates = countDuplicates(dataset.getColumnValues(ListingColumns.ID));
            if (duplicates > 0) {
                violations.add(ViolationRecord.duplicateKeys(ListingColumns.ID, duplicates));
            }
        }

        ValidationResult result = new ValidationResult(violations, outliers);
        if (!result.isPassed()) {
            log.warn("Failed validations: {}", result.getViolationCount());
            for (ViolationRecord violation : result.getViolations()) {
                log.warn("  - {}", violation.getDescription());
            }
        } else {
            log.info("All data quality validations passed");
        }
        return result;
    }

    private List<ViolationRecord> checkCriticalNulls(Dataset dataset) {
        List<ViolationRecord> violations = new ArrayList<>();
        for (String column : ListingColumns.CRITICAL) {
            if (!dataset.hasColumn(column)) {
                continue;
            }
            long nullCount = dataset.getColumnValues(column).stream().filter(value -> value == null).count();
            if (nullCount > 0) {
                violations.add(ViolationRecord.criticalNulls(column, nullCount));
            }
        }
        return violations;
    }

    /**
     * Present numeric values of a column; text that does not parse as a number is ignored.
     */
    private List<Double> numericValues(Dataset dataset, String column) {
        List<Double> values = new ArrayList<>();
        for (Object value : dataset.getColumnValues(column)) {
            Double number = TransformerUtils.toDouble(value);
            if (number != null) {
                values.add(number);
            }
        }
        return values;
    }

    /**
     * Records whose key already appeared earlier. The first occurrence is not counted.
     */
    private long countDuplicates(List<Object> keys) {
        Set<Object> seen = new HashSet<>();
        long duplicates = 0;
        for (Object key : keys) {
            if (!seen.add(key)) {
                duplicates++;
            }
        }
        return duplicates;
    }
}
