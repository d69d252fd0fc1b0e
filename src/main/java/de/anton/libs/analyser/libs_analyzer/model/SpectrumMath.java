package de.anton.libs.analyser.libs_analyzer.model;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for the small array operations shared by isolation, fitting and calibration:
 * deep copies, shot averaging, trapezoidal integration, evenly spaced grids and population statistics.
 * Matrices are laid out as {@code [row][column]}, for spectra that is {@code [wavelength][shot]}.
 */
public final class SpectrumMath {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumMath.class);

    // Private constructor to prevent instantiation
    private SpectrumMath() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** Deep copy of a rectangular matrix. */
    public static double[][] copy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    /** Mean of every row, i.e. the shot-averaged spectrum of a {@code [wavelength][shot]} matrix. */
    public static double[] rowMeans(double[][] matrix) {
        double[] means = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            means[i] = StatUtils.mean(matrix[i]);
        }
        return means;
    }

    /** Extracts one column (one shot) of a {@code [wavelength][shot]} matrix. */
    public static double[] column(double[][] matrix, int columnIndex) {
        double[] column = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            column[i] = matrix[i][columnIndex];
        }
        return column;
    }

    /**
     * Numerical integral of y over x using the composite trapezoidal rule.
     * Returns 0 for fewer than two points.
     */
    public static double trapezoid(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("Trapezoid: x and y lengths differ (" + x.length + " vs " + y.length + ").");
        }
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.0;
        }
        return sum;
    }

    /** {@code count} evenly spaced values from start to end, both inclusive. */
    public static double[] linspace(double start, double end, int count) {
        if (count < 2) {
            throw new IllegalArgumentException("linspace needs at least 2 points. Got: " + count);
        }
        double[] grid = new double[count];
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            grid[i] = start + i * step;
        }
        grid[count - 1] = end;
        return grid;
    }

    /** Population standard deviation (divisor N) of {@code values[begin, begin + length)}. */
    public static double populationStd(double[] values, int begin, int length) {
        if (length <= 0) {
            logger.trace("Population std requested for an empty range, returning NaN.");
            return Double.NaN;
        }
        return new StandardDeviation(false).evaluate(values, begin, length);
    }

    public static double populationStd(double[] values) {
        return populationStd(values, 0, values.length);
    }

    public static double max(double[] values) {
        return StatUtils.max(values);
    }

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }
}
