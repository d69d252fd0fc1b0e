package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.model.CalibrationMode;
import de.anton.libs.analyser.libs_analyzer.model.FitParameter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable description of one calibration run. Peak indices are zero-based.
 *
 * @param mode              Normalization mode.
 * @param referenceName     Name of the analyte the reference values belong to.
 * @param reference         Reference value per sample, in sample order.
 * @param parameter         Fitted quantity used as signal (area or height).
 * @param baseElement       Element whose peak is calibrated.
 * @param basePeak          Peak of the base element.
 * @param normalizerElement Element used to normalize in {@link CalibrationMode#PEAK_NORM}, ignored otherwise.
 * @param normalizerPeak    Peak of the normalizer element.
 */
public record CalibrationRequest(
        CalibrationMode mode,
        String referenceName,
        double[] reference,
        FitParameter parameter,
        String baseElement,
        int basePeak,
        String normalizerElement,
        int normalizerPeak
) {

    public CalibrationRequest {
        Objects.requireNonNull(mode, "Calibration mode cannot be null.");
        Objects.requireNonNull(referenceName, "Reference name cannot be null.");
        Objects.requireNonNull(reference, "Reference values cannot be null.");
        Objects.requireNonNull(parameter, "Fit parameter cannot be null.");
        Objects.requireNonNull(baseElement, "Base element cannot be null.");
        if (mode == CalibrationMode.PEAK_NORM && normalizerElement == null) {
            throw new IllegalArgumentException("Peak Norm requires a normalizer element.");
        }
        reference = reference.clone();
    }

    public static CalibrationRequest noNorm(String referenceName, double[] reference, FitParameter parameter,
                                            String baseElement, int basePeak) {
        return new CalibrationRequest(CalibrationMode.NO_NORM, referenceName, reference, parameter, baseElement, basePeak, null, 0);
    }

    public static CalibrationRequest peakNorm(String referenceName, double[] reference, FitParameter parameter,
                                              String baseElement, int basePeak, String normalizerElement, int normalizerPeak) {
        return new CalibrationRequest(CalibrationMode.PEAK_NORM, referenceName, reference, parameter,
                baseElement, basePeak, normalizerElement, normalizerPeak);
    }

    /** All Norm or Equivalent Peak: one curve per peak of every other element. */
    public static CalibrationRequest againstAllOthers(CalibrationMode mode, String referenceName, double[] reference,
                                                      FitParameter parameter, String baseElement, int basePeak) {
        if (!mode.isPerOtherPeak()) {
            throw new IllegalArgumentException("Mode " + mode + " does not normalize against every other element.");
        }
        return new CalibrationRequest(mode, referenceName, reference, parameter, baseElement, basePeak, null, 0);
    }

    @Override
    public double[] reference() {
        return reference.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationRequest)) return false;
        CalibrationRequest that = (CalibrationRequest) o;
        return basePeak == that.basePeak && normalizerPeak == that.normalizerPeak && mode == that.mode
                && referenceName.equals(that.referenceName) && Arrays.equals(reference, that.reference)
                && parameter == that.parameter && baseElement.equals(that.baseElement)
                && Objects.equals(normalizerElement, that.normalizerElement);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(mode, referenceName, parameter, baseElement, basePeak, normalizerElement, normalizerPeak)
                + Arrays.hashCode(reference);
    }

    @Override
    public String toString() {
        return String.format("CalibrationRequest[%s, ref='%s' (%d values), %s of %s peak %d%s]",
                mode, referenceName, reference.length, parameter, baseElement, basePeak,
                mode == CalibrationMode.PEAK_NORM ? " / " + normalizerElement + " peak " + normalizerPeak : "");
    }
}
