package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Values a peak shape needs besides the optimized vector: the number of peaks,
 * the externally fixed centers (one per peak) and the shared fixed asymmetry.
 *
 * @param peakCount      Number of peaks summed by the model.
 * @param fixedCenters   Centers used by fixed-center shapes, one per peak. May be empty for free-center shapes.
 * @param fixedAsymmetry Asymmetry shared by all peaks of fixed-asymmetry shapes, NaN when unset.
 */
public record ShapeParams(int peakCount, double[] fixedCenters, double fixedAsymmetry) {

    public ShapeParams {
        if (peakCount <= 0) {
            throw new IllegalArgumentException("Peak count must be positive. Got: " + peakCount);
        }
        fixedCenters = fixedCenters == null ? new double[0] : fixedCenters.clone();
    }

    public double centerOf(int peakIndex) {
        if (peakIndex < 0 || peakIndex >= fixedCenters.length) {
            throw new IllegalStateException("No fixed center supplied for peak " + peakIndex
                    + " (" + fixedCenters.length + " centers available).");
        }
        return fixedCenters[peakIndex];
    }

    @Override
    public double[] fixedCenters() { return fixedCenters.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeParams)) return false;
        ShapeParams that = (ShapeParams) o;
        return peakCount == that.peakCount
                && Double.compare(fixedAsymmetry, that.fixedAsymmetry) == 0
                && Arrays.equals(fixedCenters, that.fixedCenters);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(peakCount, fixedAsymmetry) + Arrays.hashCode(fixedCenters);
    }

    @Override
    public String toString() {
        return "ShapeParams[peaks=" + peakCount + ", centers=" + Arrays.toString(fixedCenters)
                + ", asymmetry=" + fixedAsymmetry + "]";
    }
}
