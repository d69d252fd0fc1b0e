package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A wavelength window attributed to one element's emission line(s), typically a row of the region table.
 * This class is immutable.
 */
public final class Region {

    private final String element;   // Unique element identifier, e.g. "Fe"
    private final double lower;     // Lower wavelength bound (nm)
    private final double upper;     // Upper wavelength bound (nm)
    private final double[] centers; // One center per peak
    private final int peakCount;

    /**
     * Constructor for Region.
     *
     * @param element   Element name (must not be null or empty).
     * @param lower     Lower bound, must be smaller than upper.
     * @param upper     Upper bound.
     * @param centers   Peak centers, one per declared peak.
     * @param peakCount Declared number of peaks (must equal centers.length).
     */
    public Region(String element, double lower, double upper, double[] centers, int peakCount) {
        this.element = Objects.requireNonNull(element, "Element name cannot be null.");
        if (element.trim().isEmpty()) {
            throw new IllegalArgumentException("Element name cannot be empty.");
        }
        if (Double.isNaN(lower) || Double.isNaN(upper) || !(lower < upper)) {
            throw new IllegalArgumentException(String.format(
                    "Lower bound must be below upper bound for element '%s'. Got: %.4f - %.4f", element, lower, upper));
        }
        Objects.requireNonNull(centers, "Centers cannot be null for element '" + element + "'.");
        if (peakCount <= 0) {
            throw new IllegalArgumentException("Peak count must be positive for element '" + element + "'. Got: " + peakCount);
        }
        if (centers.length != peakCount) {
            throw new IllegalArgumentException(String.format(
                    "Element '%s' declares %d peak(s) but %d center(s).", element, peakCount, centers.length));
        }
        this.lower = lower;
        this.upper = upper;
        this.centers = centers.clone();
        this.peakCount = peakCount;
    }

    /** Convenience constructor deriving the peak count from the centers. */
    public Region(String element, double lower, double upper, double... centers) {
        this(element, lower, upper, centers, centers == null ? 0 : centers.length);
    }

    // --- Getters ---
    public String getElement() { return element; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }
    public double[] getCenters() { return centers.clone(); }
    public int getPeakCount() { return peakCount; }

    public boolean contains(double wavelength) {
        return wavelength >= lower && wavelength <= upper;
    }

    @Override
    public String toString() {
        return String.format("Region[Element='%s', %.4f-%.4f nm, Centers=%s, Peaks=%d]",
                element, lower, upper, Arrays.toString(centers), peakCount);
    }

    // Equality based on the element name, which is unique within a region table.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Region that = (Region) o;
        return Objects.equals(element, that.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element);
    }
}
