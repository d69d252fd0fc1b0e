package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-peak model curves evaluated on a common grid, plus their elementwise sum ("Total").
 * The total is always derived from the peak columns, never supplied separately.
 */
public final class CurveSet {

    private static final CurveSet EMPTY = new CurveSet(new double[0], new double[0][]);

    private final double[] grid;
    private final double[][] peakCurves; // [peak][grid point]
    private final double[] total;

    public CurveSet(double[] grid, double[][] peakCurves) {
        Objects.requireNonNull(grid, "Curve grid cannot be null.");
        Objects.requireNonNull(peakCurves, "Peak curves cannot be null.");
        for (double[] curve : peakCurves) {
            if (curve.length != grid.length) {
                throw new IllegalArgumentException(String.format(
                        "Peak curve length %d does not match grid length %d.", curve.length, grid.length));
            }
        }
        this.grid = grid.clone();
        this.peakCurves = SpectrumMath.copy(peakCurves);
        this.total = new double[grid.length];
        for (double[] curve : this.peakCurves) {
            for (int i = 0; i < curve.length; i++) {
                total[i] += curve[i];
            }
        }
    }

    public static CurveSet empty() {
        return EMPTY;
    }

    // --- Getters ---
    public double[] getGrid() { return grid.clone(); }
    public int getPeakCount() { return peakCurves.length; }
    public double[] getPeakCurve(int peakIndex) { return peakCurves[peakIndex].clone(); }
    public double[][] getPeakCurves() { return SpectrumMath.copy(peakCurves); }
    public double[] getTotal() { return total.clone(); }
    public boolean isEmpty() { return grid.length == 0; }

    @Override
    public String toString() {
        return "CurveSet{points=" + grid.length + ", peaks=" + peakCurves.length
                + ", range=" + (grid.length == 0 ? "[]" : Arrays.toString(new double[]{grid[0], grid[grid.length - 1]})) + '}';
    }
}
