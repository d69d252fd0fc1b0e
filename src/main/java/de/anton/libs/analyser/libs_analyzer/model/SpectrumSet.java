package de.anton.libs.analyser.libs_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sample set sharing one wavelength axis. Each sample carries an intensity matrix
 * laid out as {@code [wavelength index][shot index]}.
 * Matrices are copied on the way in and on the way out, so instances are effectively immutable.
 */
public final class SpectrumSet {

    private final double[] wavelengths;
    private final List<String> sampleNames;
    private final List<double[][]> intensities;

    /**
     * @param wavelengths Strictly ascending, finite wavelength axis.
     * @param sampleNames One name per sample.
     * @param intensities One matrix per sample, each with {@code wavelengths.length} rows and at least one shot column.
     * @throws IllegalArgumentException If the axis is not strictly ascending or a matrix does not fit the axis.
     */
    public SpectrumSet(double[] wavelengths, List<String> sampleNames, List<double[][]> intensities) {
        Objects.requireNonNull(wavelengths, "Wavelength axis cannot be null.");
        Objects.requireNonNull(sampleNames, "Sample names cannot be null.");
        Objects.requireNonNull(intensities, "Intensities cannot be null.");
        if (wavelengths.length < 2) {
            throw new IllegalArgumentException("Wavelength axis needs at least 2 points. Got: " + wavelengths.length);
        }
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i])) {
                throw new IllegalArgumentException("Wavelength at index " + i + " is not finite.");
            }
            if (i > 0 && !(wavelengths[i] > wavelengths[i - 1])) {
                throw new IllegalArgumentException(String.format(
                        "Wavelengths must be strictly ascending: index %d (%.5f) <= index %d (%.5f).",
                        i, wavelengths[i], i - 1, wavelengths[i - 1]));
            }
        }
        if (sampleNames.size() != intensities.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d sample names for %d intensity matrices.", sampleNames.size(), intensities.size()));
        }
        if (intensities.isEmpty()) {
            throw new IllegalArgumentException("Spectrum set must contain at least one sample.");
        }

        List<double[][]> copied = new ArrayList<>(intensities.size());
        for (int s = 0; s < intensities.size(); s++) {
            double[][] matrix = intensities.get(s);
            String name = sampleNames.get(s);
            if (matrix == null || matrix.length != wavelengths.length) {
                throw new IllegalArgumentException(String.format("Sample '%s': expected %d rows, found %s.",
                        name, wavelengths.length, matrix == null ? "null" : String.valueOf(matrix.length)));
            }
            int shots = matrix[0] == null ? 0 : matrix[0].length;
            if (shots == 0) {
                throw new IllegalArgumentException("Sample '" + name + "' has no shots.");
            }
            for (int r = 0; r < matrix.length; r++) {
                if (matrix[r] == null || matrix[r].length != shots) {
                    throw new IllegalArgumentException(String.format(
                            "Sample '%s': inconsistent number of shots at row %d. Expected %d.", name, r, shots));
                }
            }
            copied.add(SpectrumMath.copy(matrix));
        }

        this.wavelengths = wavelengths.clone();
        this.sampleNames = List.copyOf(sampleNames);
        this.intensities = Collections.unmodifiableList(copied);
    }

    // --- Getters ---
    public double[] getWavelengths() { return wavelengths.clone(); }
    public double getFirstWavelength() { return wavelengths[0]; }
    public double getLastWavelength() { return wavelengths[wavelengths.length - 1]; }
    public int getWavelengthCount() { return wavelengths.length; }
    public int getSampleCount() { return intensities.size(); }
    public List<String> getSampleNames() { return sampleNames; }

    /** @return A copy of the {@code [wavelength][shot]} matrix of the given sample. */
    public double[][] getIntensities(int sampleIndex) {
        return SpectrumMath.copy(intensities.get(sampleIndex));
    }

    public int getShotCount(int sampleIndex) {
        return intensities.get(sampleIndex)[0].length;
    }

    /** @return The shot-averaged spectrum of the given sample. */
    public double[] getMeanSpectrum(int sampleIndex) {
        return SpectrumMath.rowMeans(intensities.get(sampleIndex));
    }

    /** Creates a set with the same axis and names but new intensity matrices. */
    public SpectrumSet withIntensities(List<double[][]> newIntensities) {
        return new SpectrumSet(wavelengths, sampleNames, newIntensities);
    }

    @Override
    public String toString() {
        return String.format("SpectrumSet[samples=%d, wavelengths=%d (%.3f-%.3f nm)]",
                getSampleCount(), wavelengths.length, getFirstWavelength(), getLastWavelength());
    }
}
