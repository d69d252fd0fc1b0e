package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.ProgressListener;
import de.anton.libs.analyser.libs_analyzer.model.ProgressReporter;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumSet;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pearson correlation, wavelength by wavelength, between the samples' mean intensities and
 * reference concentrations. Helps to find emission lines that track an analyte.
 */
public final class CorrelationSpectrum {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationSpectrum.class);

    private final double[] wavelengths;
    private final Map<String, double[]> coefficients; // reference name -> coefficient per wavelength
    private final double[] normalizedMean;

    private CorrelationSpectrum(double[] wavelengths, Map<String, double[]> coefficients, double[] normalizedMean) {
        this.wavelengths = wavelengths;
        this.coefficients = coefficients;
        this.normalizedMean = normalizedMean;
    }

    /**
     * @param spectra    Spectrum set with at least 3 samples.
     * @param references Reference name to one value per sample, in sample order.
     * @throws IllegalArgumentException If fewer than 3 samples are given or a reference has the wrong length.
     * @throws InterruptedException     If the calling thread is interrupted between references.
     */
    public static CorrelationSpectrum compute(SpectrumSet spectra, Map<String, double[]> references,
                                              ProgressListener listener) throws InterruptedException {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        if (references == null || references.isEmpty()) {
            throw new IllegalArgumentException("At least one reference is required for the correlation spectrum.");
        }
        int samples = spectra.getSampleCount();
        if (samples < 3) {
            throw new IllegalArgumentException("Correlation needs at least 3 samples. Got: " + samples);
        }
        for (Map.Entry<String, double[]> entry : references.entrySet()) {
            if (entry.getValue() == null || entry.getValue().length != samples) {
                throw new IllegalArgumentException(String.format("Reference '%s' must hold %d value(s).", entry.getKey(), samples));
            }
        }

        int points = spectra.getWavelengthCount();
        double[][] means = new double[points][samples]; // [wavelength][sample]
        for (int s = 0; s < samples; s++) {
            double[] mean = spectra.getMeanSpectrum(s);
            for (int i = 0; i < points; i++) {
                means[i][s] = mean[i];
            }
        }

        logger.info("Computing correlation spectrum for {} reference(s) over {} wavelengths.", references.size(), points);
        ProgressReporter progress = new ProgressReporter(listener, references.size());
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        Map<String, double[]> coefficients = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : references.entrySet()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Correlation spectrum cancelled before reference " + entry.getKey());
            }
            double[] r = new double[points];
            for (int i = 0; i < points; i++) {
                r[i] = pearson.correlation(means[i], entry.getValue()); // NaN for a constant wavelength
            }
            coefficients.put(entry.getKey(), r);
            progress.unitDone();
        }

        double[] grandMean = new double[points];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < points; i++) {
            double sum = 0.0;
            for (int s = 0; s < samples; s++) {
                sum += means[i][s];
            }
            grandMean[i] = sum / samples;
            max = Math.max(max, grandMean[i]);
        }
        if (max != 0.0) {
            for (int i = 0; i < points; i++) {
                grandMean[i] /= max;
            }
        } else {
            logger.warn("Grand mean spectrum peaks at 0, returning it unnormalized.");
        }
        return new CorrelationSpectrum(spectra.getWavelengths(), Collections.unmodifiableMap(coefficients), grandMean);
    }

    public double[] getWavelengths() { return wavelengths.clone(); }
    public Map<String, double[]> getCoefficients() { return coefficients; }
    public double[] getCoefficients(String reference) {
        double[] r = coefficients.get(reference);
        if (r == null) {
            throw new IllegalArgumentException("No correlation computed for reference '" + reference + "'.");
        }
        return r.clone();
    }
    /** Grand mean over all samples, divided by its maximum. */
    public double[] getNormalizedMean() { return normalizedMean.clone(); }
}
