package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.model.ColumnStatistics;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.SummaryReport;
import teranet.mapdev.propertyetl.model.ViolationRecord;
import teranet.mapdev.propertyetl.util.StatisticsUtil;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the summary report of a pipeline run.
 *
 * The statistics block covers every numeric column of the processed dataset:
 * a column with at least one present value where all present values are
 * numbers. It is omitted when no column qualifies.
 */
@Service
@Slf4j
public class SummaryReportService {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * @param original   the extracted dataset, may be null
     * @param processed  the transformed dataset
     * @param violations findings of the most recent validation pass
     * @param now        report timestamp
     */
    public SummaryReport generate(Dataset original, Dataset processed,
                                  List<ViolationRecord> violations, LocalDateTime now) {
        Map<String, ColumnStatistics> statistics = describeNumericColumns(processed);

        SummaryReport report = SummaryReport.builder()
                .processedAt(now.format(TIMESTAMP_FORMAT))
                .originalRecords(original != null ? original.size() : 0)
                .processedRecords(processed.size())
                .columns(processed.columnCount())
                .failedValidations(violations.size())
                .errors(violations)
                .statistics(statistics.isEmpty() ? null : Collections.unmodifiableMap(statistics))
                .build();

        log.debug("Summary report built: {} numeric columns described", statistics.size());
        return report;
    }

    /**
     * count / mean / std / min / quartiles / max per numeric column, in column order.
     */
    public Map<String, ColumnStatistics> describeNumericColumns(Dataset dataset) {
        Map<String, ColumnStatistics> statistics = new LinkedHashMap<>();
        for (String column : dataset.getColumns()) {
            List<Double> values = numericValues(dataset.getColumnValues(column));
            if (values != null) {
                statistics.put(column, describe(values));
            }
        }
        return statistics;
    }

    public ColumnStatistics describe(List<Double> values) {
        return ColumnStatistics.builder()
                .count(values.size())
                .mean(StatisticsUtil.mean(values))
                .std(StatisticsUtil.sampleStandardDeviation(values))
                .min(values.isEmpty() ? null : Collections.min(values))
                .percentile25(StatisticsUtil.quantile(values, 0.25))
                .median(StatisticsUtil.quantile(values, 0.50))
                .percentile75(StatisticsUtil.quantile(values, 0.75))
                .max(values.isEmpty() ? null : Collections.max(values))
                .build();
    }

    /**
     * Present finite values as doubles, or null when the column is not numeric.
     */
    private List<Double> numericValues(List<Object> columnValues) {
        List<Double> values = new ArrayList<>();
        for (Object value : columnValues) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                return null;
            }
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number)) {
                values.add(number);
            }
        }
        return values.isEmpty() ? null : values;
    }
}
