package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;

/**
 * Builds the starting parameter vector of a fit in the layout {@link PeakShapeModel} expects.
 * Later peaks start smaller ({@code r = 1 - 0.4 * i / peaks}) so that overlapping peaks do not begin identical.
 */
public final class GuessBuilder {

    private GuessBuilder() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * @param x         Window wavelengths (ascending, at least 2 points).
     * @param y         Signal to fit.
     * @param peakCount Number of peaks.
     * @param centers   Declared centers, one per peak.
     * @param shape     Shape to fit.
     * @param asymmetry Start asymmetry for shapes that optimize it.
     * @return Start vector of length {@code peakCount * shape.getParametersPerPeak()}.
     */
    public static double[] guess(double[] x, double[] y, int peakCount, double[] centers, PeakShape shape, double asymmetry) {
        if (x.length < 2 || y.length != x.length) {
            throw new IllegalArgumentException("Guess needs at least 2 points and matching x/y lengths.");
        }
        if (peakCount <= 0 || centers.length < peakCount) {
            throw new IllegalArgumentException(String.format("Guess needs %d center(s), got %d.", peakCount, centers.length));
        }
        double maxY = SpectrumMath.max(y);
        double span = x[x.length - 1] - x[0];
        double[] guess = new double[peakCount * shape.getParametersPerPeak()];
        int k = 0;
        for (int i = 0; i < peakCount; i++) {
            double r = 1.0 - 0.4 * i / peakCount;
            if (shape.isVoigt()) {
                guess[k++] = r * maxY * span / 2.0; // area of a triangle
                guess[k++] = r * span / 4.0;
                guess[k++] = r * span / 4.0;
            } else {
                guess[k++] = r * maxY;
                guess[k++] = r * span / 4.0;
            }
            if (!shape.isCenterFixed()) {
                guess[k++] = centers[i];
            }
            if (shape.getAsymmetryMode() == PeakShape.AsymmetryMode.FREE) {
                guess[k++] = asymmetry;
            }
        }
        return guess;
    }
}
