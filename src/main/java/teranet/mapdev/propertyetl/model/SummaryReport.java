package teranet.mapdev.propertyetl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one pipeline run, created once after transformation.
 *
 * JSON keys are fixed for downstream consumers of the report. The statistics
 * block is left out of the plain-text rendering.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"fecha_procesamiento", "registros_originales", "registros_procesados",
        "columnas", "validaciones_fallidas", "errores", "estadisticas"})
public class SummaryReport {

    public static final String KEY_PROCESSED_AT = "fecha_procesamiento";
    public static final String KEY_ORIGINAL_RECORDS = "registros_originales";
    public static final String KEY_PROCESSED_RECORDS = "registros_procesados";
    public static final String KEY_COLUMNS = "columnas";
    public static final String KEY_FAILED_VALIDATIONS = "validaciones_fallidas";
    public static final String KEY_ERRORS = "errores";
    public static final String KEY_STATISTICS = "estadisticas";

    /** Run timestamp, formatted yyyy-MM-dd HH:mm:ss */
    @JsonProperty(KEY_PROCESSED_AT)
    String processedAt;

    @JsonProperty(KEY_ORIGINAL_RECORDS)
    int originalRecords;

    @JsonProperty(KEY_PROCESSED_RECORDS)
    int processedRecords;

    @JsonProperty(KEY_COLUMNS)
    int columns;

    @JsonProperty(KEY_FAILED_VALIDATIONS)
    int failedValidations;

    @Singular
    @JsonProperty(KEY_ERRORS)
    List<ViolationRecord> errors;

    /** Per numeric column, keyed by column name; null when no column is numeric */
    @JsonProperty(KEY_STATISTICS)
    Map<String, ColumnStatistics> statistics;

    /**
     * Report as an ordered mapping using the fixed report keys.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_PROCESSED_AT, processedAt);
        map.put(KEY_ORIGINAL_RECORDS, originalRecords);
        map.put(KEY_PROCESSED_RECORDS, processedRecords);
        map.put(KEY_COLUMNS, columns);
        map.put(KEY_FAILED_VALIDATIONS, failedValidations);
        map.put(KEY_ERRORS, errors);
        if (statistics != null) {
            map.put(KEY_STATISTICS, statistics);
        }
        return map;
    }

    /**
     * One "key: value" line per report entry, statistics excluded.
     */
    public List<String> toPlainTextLines() {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Object> entry : toMap().entrySet()) {
            if (KEY_STATISTICS.equals(entry.getKey())) {
                continue;
            }
            lines.add(entry.getKey() + ": " + entry.getValue());
        }
        return lines;
    }
}
