package com.company.pmm.util;

import com.company.pmm.domain.MetricPoint;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Descriptive statistics shared by signal detection and trend analysis.
 * Standard deviation is always the sample (n - 1) form so both agree.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double[] values(List<MetricPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    private static DescriptiveStatistics describe(double[] values, int from, int to) {
        return new DescriptiveStatistics(Arrays.copyOfRange(values, from, Math.max(from, to)));
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of values[from, to). Returns 0 for an empty range.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        return describe(values, from, to).getMean();
    }

    public static double sampleStdDev(double[] values) {
        return sampleStdDev(values, 0, values.length);
    }

    /**
     * Sample standard deviation of values[from, to); 0 when fewer than two values.
     */
    public static double sampleStdDev(double[] values, int from, int to) {
        if (to - from < 2) {
            return 0.0;
        }
        return describe(values, from, to).getStandardDeviation();
    }

    public static double min(double[] values) {
        return new DescriptiveStatistics(values).getMin();
    }

    public static double max(double[] values) {
        return new DescriptiveStatistics(values).getMax();
    }

    /**
     * Splits by count into an earlier half [0, n/2) and a later half [n/2, n).
     * Empty when there are fewer than two values or the earlier mean is zero.
     */
    public static Optional<HalfSplit> halfSplit(double[] values) {
        if (values.length < 2) {
            return Optional.empty();
        }
        int middle = values.length / 2;
        double earlier = mean(values, 0, middle);
        double later = mean(values, middle, values.length);
        if (earlier == 0.0) {
            return Optional.empty();
        }
        return Optional.of(new HalfSplit(earlier, later));
    }

    /**
     * Least-squares line over (index, value) pairs. Requires at least two values.
     * Residual variance is SSE / (n - 2), or 0 for an exact two-point line.
     */
    public static LinearFit linearFit(double[] values) {
        int n = values.length;
        if (n < 2) {
            throw new IllegalArgumentException("Linear fit needs at least 2 values, got " + n);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, values[i]);
        }
        double residualVariance = n > 2 ? regression.getMeanSquareError() : 0.0;
        return new LinearFit(regression, residualVariance, mean(values));
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    @Value
    public static class HalfSplit {
        double earlierMean;
        double laterMean;

        public double pctChange() {
            return (laterMean - earlierMean) / earlierMean;
        }
    }

    @Value
    public static class LinearFit {
        SimpleRegression regression;
        double residualVariance;
        double meanValue;

        public double getSlope() {
            return regression.getSlope();
        }

        public double getIntercept() {
            return regression.getIntercept();
        }

        public double valueAt(double index) {
            return regression.predict(index);
        }
    }
}
