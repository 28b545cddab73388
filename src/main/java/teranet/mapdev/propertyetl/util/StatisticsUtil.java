package teranet.mapdev.propertyetl.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Numeric helpers shared by validation and reporting.
 *
 * Quantiles use linear interpolation between the two nearest ranks: for a
 * sorted sample x of size n, position p = q * (n - 1) and the result is
 * x[floor(p)] + (x[ceil(p)] - x[floor(p)]) * (p - floor(p)). Outlier counts
 * depend on this choice, so it must not change.
 */
public class StatisticsUtil {

    public static final double IQR_MULTIPLIER = 1.5;

    private StatisticsUtil() {
    }

    /**
     * Linear-interpolated quantile of the given values.
     *
     * @param values   non-missing values in any order
     * @param quantile between 0 and 1 inclusive
     * @return the quantile, or null when there are no values
     */
    public static Double quantile(Collection<Double> values, double quantile) {
        if (quantile < 0 || quantile > 1) {
            throw new IllegalArgumentException("Quantile must be between 0 and 1: " + quantile);
        }
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sortedQuantile(sorted, quantile);
    }

    private static double sortedQuantile(List<Double> sorted, double quantile) {
        double position = quantile * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double lowerValue = sorted.get(lower);
        double upperValue = sorted.get(upper);
        return lowerValue + (upperValue - lowerValue) * (position - lower);
    }

    /**
     * Counts values outside [Q1 - 1.5 * IQR, Q3 + 1.5 * IQR].
     */
    public static long countIqrOutliers(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double q1 = quantile(values, 0.25);
        double q3 = quantile(values, 0.75);
        double iqr = q3 - q1;
        double lowerBound = q1 - IQR_MULTIPLIER * iqr;
        double upperBound = q3 + IQR_MULTIPLIER * iqr;

        long outliers = 0;
        for (Double value : values) {
            if (value < lowerBound || value > upperBound) {
                outliers++;
            }
        }
        return outliers;
    }

    public static Double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (Double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator); null below two values.
     */
    public static Double sampleStandardDeviation(Collection<Double> values) {
        if (values.size() < 2) {
            return null;
        }
        double mean = mean(values);
        double squares = 0;
        for (Double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / (values.size() - 1));
    }
}
