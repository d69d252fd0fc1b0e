package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Arrays;

/**
 * Per-peak height, width and area of one fit unit, with their population standard deviations
 * across shots (all zero when the shots were averaged before fitting).
 */
public record PeakMetrics(double[] heights, double[] widths, double[] areas,
                          double[] heightStd, double[] widthStd, double[] areaStd) {

    public PeakMetrics {
        int n = heights.length;
        if (widths.length != n || areas.length != n || heightStd.length != n || widthStd.length != n || areaStd.length != n) {
            throw new IllegalArgumentException("All per-peak metric arrays must have the same length (" + n + ").");
        }
        heights = heights.clone();
        widths = widths.clone();
        areas = areas.clone();
        heightStd = heightStd.clone();
        widthStd = widthStd.clone();
        areaStd = areaStd.clone();
    }

    /** Metrics of a single solve: standard deviations are zero. */
    public static PeakMetrics single(double[] heights, double[] widths, double[] areas) {
        int n = heights.length;
        return new PeakMetrics(heights, widths, areas, new double[n], new double[n], new double[n]);
    }

    /** NaN metrics for a unit that could not be computed. */
    public static PeakMetrics undefined(int peakCount) {
        double[] nan = new double[peakCount];
        Arrays.fill(nan, Double.NaN);
        return new PeakMetrics(nan, nan, nan, nan, nan, nan);
    }

    public int peakCount() { return heights.length; }

    @Override public double[] heights() { return heights.clone(); }
    @Override public double[] widths() { return widths.clone(); }
    @Override public double[] areas() { return areas.clone(); }
    @Override public double[] heightStd() { return heightStd.clone(); }
    @Override public double[] widthStd() { return widthStd.clone(); }
    @Override public double[] areaStd() { return areaStd.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeakMetrics)) return false;
        PeakMetrics that = (PeakMetrics) o;
        return Arrays.equals(heights, that.heights) && Arrays.equals(widths, that.widths)
                && Arrays.equals(areas, that.areas) && Arrays.equals(heightStd, that.heightStd)
                && Arrays.equals(widthStd, that.widthStd) && Arrays.equals(areaStd, that.areaStd);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(heights);
        result = 31 * result + Arrays.hashCode(widths);
        result = 31 * result + Arrays.hashCode(areas);
        return result;
    }

    @Override
    public String toString() {
        return "PeakMetrics[heights=" + Arrays.toString(heights) + ", widths=" + Arrays.toString(widths)
                + ", areas=" + Arrays.toString(areas) + "]";
    }
}
