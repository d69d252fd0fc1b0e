package de.anton.libs.analyser.libs_analyzer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds spectrum sets from Gaussian lines on a linear background, with optional seeded noise.
 */
public final class SyntheticSpectra {

    private SyntheticSpectra() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** {@code h * exp(-2 ((x - c) / w)^2)}, the Gaussian the fitter uses. */
    public static double gaussian(double x, double height, double width, double center) {
        double u = (x - center) / width;
        return height * Math.exp(-2.0 * u * u);
    }

    /**
     * One Gaussian line per sample, sample {@code s} having height {@code heights[s]}.
     *
     * @param noise Standard deviation of the additive noise, 0 for exact data.
     */
    public static SpectrumSet gaussianLines(double[] axis, double[] heights, double width, double center,
                                            int shots, double noise, long seed) {
        Random random = new Random(seed);
        List<String> names = new ArrayList<>();
        List<double[][]> matrices = new ArrayList<>();
        for (int s = 0; s < heights.length; s++) {
            double[][] matrix = new double[axis.length][shots];
            for (int i = 0; i < axis.length; i++) {
                double clean = gaussian(axis[i], heights[s], width, center);
                for (int k = 0; k < shots; k++) {
                    matrix[i][k] = clean + noise * random.nextGaussian();
                }
            }
            names.add("Sample " + (s + 1));
            matrices.add(matrix);
        }
        return new SpectrumSet(axis, names, matrices);
    }

    /** Every shot of every sample equals {@code offset + slope * x}. */
    public static SpectrumSet ramp(double[] axis, int samples, int shots, double offset, double slope) {
        List<String> names = new ArrayList<>();
        List<double[][]> matrices = new ArrayList<>();
        for (int s = 0; s < samples; s++) {
            double[][] matrix = new double[axis.length][shots];
            for (int i = 0; i < axis.length; i++) {
                for (int k = 0; k < shots; k++) {
                    matrix[i][k] = offset + slope * axis[i];
                }
            }
            names.add("Ramp " + (s + 1));
            matrices.add(matrix);
        }
        return new SpectrumSet(axis, names, matrices);
    }

    /** A single-sample set from an explicit {@code [wavelength][shot]} matrix. */
    public static SpectrumSet single(double[] axis, double[][] matrix) {
        return new SpectrumSet(axis, List.of("Sample"), List.<double[][]>of(matrix));
    }
}
