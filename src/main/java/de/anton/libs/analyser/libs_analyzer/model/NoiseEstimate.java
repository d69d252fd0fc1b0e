package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Noise of one isolated sample window: population standard deviation of the
 * leftmost and the rightmost part of the shot-averaged signal.
 */
public record NoiseEstimate(double left, double right) {

    /** Fraction of the window used on each side. */
    public static final double EDGE_FRACTION = 0.2;
    /** Minimum number of points used on each side. */
    public static final int MIN_EDGE_POINTS = 2;

    /** @return The smaller of the two edge deviations. */
    public double min() {
        return Math.min(left, right);
    }

    /** Number of points per edge for a window of the given size: {@code max(2, floor(0.2 * n))}. */
    public static int edgeSize(int windowSize) {
        int edge = (int) (EDGE_FRACTION * windowSize);
        return Math.max(MIN_EDGE_POINTS, edge);
    }

    /**
     * Estimates the noise pair of a shot-averaged window.
     *
     * @param meanSignal Shot-averaged intensities of the window (at least 2 points).
     */
    public static NoiseEstimate of(double[] meanSignal) {
        int n = meanSignal.length;
        int edge = Math.min(edgeSize(n), n);
        double left = SpectrumMath.populationStd(meanSignal, 0, edge);
        double right = SpectrumMath.populationStd(meanSignal, n - edge, edge);
        return new NoiseEstimate(left, right);
    }
}
