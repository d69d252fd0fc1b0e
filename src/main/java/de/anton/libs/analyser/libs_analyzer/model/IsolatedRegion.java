package de.anton.libs.analyser.libs_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of cropping a spectrum set to one {@link Region}: the cropped axis, the per-sample
 * {@code [wavelength][shot]} matrices (baseline-corrected if requested) and the per-sample noise.
 */
public final class IsolatedRegion {

    private final Region region;
    private final double[] wavelengths;
    private final List<double[][]> intensities;
    private final List<NoiseEstimate> noise;

    public IsolatedRegion(Region region, double[] wavelengths, List<double[][]> intensities, List<NoiseEstimate> noise) {
        this.region = Objects.requireNonNull(region, "Region cannot be null.");
        Objects.requireNonNull(wavelengths, "Wavelengths cannot be null for " + region.getElement());
        Objects.requireNonNull(intensities, "Intensities cannot be null for " + region.getElement());
        Objects.requireNonNull(noise, "Noise cannot be null for " + region.getElement());
        if (intensities.size() != noise.size()) {
            throw new IllegalArgumentException(String.format("Element '%s': %d intensity matrices but %d noise estimates.",
                    region.getElement(), intensities.size(), noise.size()));
        }
        List<double[][]> copied = new ArrayList<>(intensities.size());
        for (double[][] matrix : intensities) {
            if (matrix.length != wavelengths.length) {
                throw new IllegalArgumentException("Element '" + region.getElement()
                        + "': matrix rows do not match the isolated axis.");
            }
            copied.add(SpectrumMath.copy(matrix));
        }
        this.wavelengths = wavelengths.clone();
        this.intensities = Collections.unmodifiableList(copied);
        this.noise = List.copyOf(noise);
    }

    // --- Getters ---
    public Region getRegion() { return region; }
    public String getElement() { return region.getElement(); }
    public int getPeakCount() { return region.getPeakCount(); }
    public double[] getWavelengths() { return wavelengths.clone(); }
    public int getSampleCount() { return intensities.size(); }
    public double[][] getIntensities(int sampleIndex) { return SpectrumMath.copy(intensities.get(sampleIndex)); }
    public double[] getMeanSpectrum(int sampleIndex) { return SpectrumMath.rowMeans(intensities.get(sampleIndex)); }
    public NoiseEstimate getNoise(int sampleIndex) { return noise.get(sampleIndex); }
    public List<NoiseEstimate> getNoise() { return noise; }

    @Override
    public String toString() {
        return "IsolatedRegion{" + "element='" + region.getElement() + '\''
                + ", points=" + wavelengths.length + ", samples=" + intensities.size() + '}';
    }
}
