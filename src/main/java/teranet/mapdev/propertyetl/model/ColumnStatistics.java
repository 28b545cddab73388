package teranet.mapdev.propertyetl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics of one numeric column.
 * Every figure except {@code count} is null when it is undefined for the column
 * (no values at all, or a standard deviation over fewer than two values).
 */
@Value
@Builder
@JsonPropertyOrder({"count", "mean", "std", "min", "25%", "50%", "75%", "max"})
public class ColumnStatistics {

    @JsonProperty("count")
    long count;

    @JsonProperty("mean")
    Double mean;

    /** Sample standard deviation (n - 1 denominator) */
    @JsonProperty("std")
    Double std;

    @JsonProperty("min")
    Double min;

    @JsonProperty("25%")
    Double percentile25;

    @JsonProperty("50%")
    Double median;

    @JsonProperty("75%")
    Double percentile75;

    @JsonProperty("max")
    Double max;
}
