package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.model.CalibrationCurve;
import de.anton.libs.analyser.libs_analyzer.model.CalibrationMode;
import de.anton.libs.analyser.libs_analyzer.model.FitResults;
import de.anton.libs.analyser.libs_analyzer.model.IsolatedRegion;
import de.anton.libs.analyser.libs_analyzer.model.LimitStatus;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds linear calibration curves from fitted peak values and reference concentrations.
 * <p>
 * Each curve regresses the (normalized) signal on the reference, {@code signal = intercept + slope * reference}.
 * The predicted reference comes from the inverse regression (reference on signal), whose coefficients are kept on
 * the curve as prediction slope and intercept, and the RMSE is computed on those predictions. Detection limits use the noise of the samples with the lowest reference:
 * {@code LoD = 3.3 * sigma / |slope|}, {@code LoQ = 10 * sigma / |slope|}.
 */
public class CalibrationService {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationService.class);

    public static final double LOD_FACTOR = 3.3;
    public static final double LOQ_FACTOR = 10.0;

    /**
     * @param request  What to calibrate.
     * @param fits     Fit results of all elements.
     * @param isolated Isolated regions, providing the noise per element and sample.
     * @return One curve for No Norm and Peak Norm, one per peak of every other element for All Norm and Equivalent Peak.
     * @throws IllegalArgumentException If an element or peak does not exist, the reference length does not match the
     *                                  sample count, or the reference holds fewer than two distinct values.
     */
    public List<CalibrationCurve> calibrate(CalibrationRequest request, FitResults fits, List<IsolatedRegion> isolated) {
        Objects.requireNonNull(request, "Calibration request cannot be null.");
        Objects.requireNonNull(fits, "Fit results cannot be null.");
        Objects.requireNonNull(isolated, "Isolated regions cannot be null.");
        double[] reference = request.reference();
        validate(request, reference, fits);
        logger.info("Service: Calibrating {} ({}) of {} peak {} against '{}'.",
                request.parameter(), request.mode(), request.baseElement(), request.basePeak() + 1, request.referenceName());

        double[] base = column(fits.values(request.baseElement(), request.parameter()), request.basePeak());
        double sigmaBase = lowestReferenceNoise(request.baseElement(), isolated, reference);
        String baseLabel = peakLabel(request.baseElement(), request.basePeak());

        List<CalibrationCurve> curves = new ArrayList<>();
        switch (request.mode()) {
            case NO_NORM:
                curves.add(buildCurve(baseLabel, request, reference, base, sigmaBase));
                break;
            case PEAK_NORM: {
                double[] normalizer = column(fits.values(request.normalizerElement(), request.parameter()), request.normalizerPeak());
                double sigmaNorm = lowestReferenceNoise(request.normalizerElement(), isolated, reference);
                curves.add(buildCurve(baseLabel + " / " + peakLabel(request.normalizerElement(), request.normalizerPeak()),
                        request, reference, ratio(base, normalizer), sigmaBase / sigmaNorm));
                break;
            }
            case ALL_NORM:
            case EQUIVALENT_PEAK:
                for (String other : fits.getElements()) {
                    if (other.equals(request.baseElement())) continue;
                    double[][] values = fits.values(other, request.parameter());
                    double sigmaOther = lowestReferenceNoise(other, isolated, reference);
                    for (int p = 0; p < fits.getPeakCount(other); p++) {
                        double[] o = column(values, p);
                        String otherLabel = peakLabel(other, p);
                        if (request.mode() == CalibrationMode.ALL_NORM) {
                            curves.add(buildCurve(baseLabel + " / " + otherLabel, request, reference,
                                    ratio(base, o), sigmaBase / sigmaOther));
                        } else {
                            curves.add(buildCurve(String.format("%1$s * %2$s / (%1$s + %2$s)", baseLabel, otherLabel),
                                    request, reference, equivalent(base, o),
                                    equivalentNoise(sigmaBase, sigmaOther)));
                        }
                    }
                }
                if (curves.isEmpty()) {
                    logger.warn("Service: {} produced no curve, '{}' is the only fitted element.", request.mode(), request.baseElement());
                }
                break;
            default:
                throw new IllegalStateException("Unhandled calibration mode: " + request.mode());
        }
        logger.info("Service: Calibration produced {} curve(s).", curves.size());
        return Collections.unmodifiableList(curves);
    }

    private void validate(CalibrationRequest request, double[] reference, FitResults fits) {
        checkPeak(fits, request.baseElement(), request.basePeak());
        if (request.mode() == CalibrationMode.PEAK_NORM) {
            checkPeak(fits, request.normalizerElement(), request.normalizerPeak());
        }
        if (reference.length != fits.getSampleCount()) {
            throw new IllegalArgumentException(String.format("Reference '%s' holds %d value(s) for %d sample(s).",
                    request.referenceName(), reference.length, fits.getSampleCount()));
        }
        long distinct = Arrays.stream(reference).distinct().count();
        if (distinct < 2) {
            throw new IllegalArgumentException("Reference '" + request.referenceName() + "' needs at least two distinct values.");
        }
        for (double value : reference) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Reference '" + request.referenceName() + "' contains non-finite values.");
            }
        }
    }

    private void checkPeak(FitResults fits, String element, int peak) {
        if (!fits.contains(element)) {
            throw new IllegalArgumentException("Unknown element '" + element + "'. Fitted elements: " + fits.getElements());
        }
        int peaks = fits.getPeakCount(element);
        if (peak < 0 || peak >= peaks) {
            throw new IllegalArgumentException(String.format("Element '%s' has %d peak(s), peak index %d is out of range.",
                    element, peaks, peak));
        }
    }

    private CalibrationCurve buildCurve(String label, CalibrationRequest request, double[] reference, double[] signal, double sigma) {
        int n = reference.length;
        double[] predicted = new double[n];
        boolean finiteSignal = Arrays.stream(signal).allMatch(Double::isFinite);
        if (!finiteSignal) {
            logger.warn("Service: Curve '{}' has non-finite signal values {}, no regression possible.", label, Arrays.toString(signal));
            Arrays.fill(predicted, Double.NaN);
            return new CalibrationCurve(label, request.referenceName(), request.parameter(), request.mode(),
                    reference, signal, predicted, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    sigma, Double.NaN, Double.NaN, LimitStatus.UNDEFINED);
        }

        SimpleRegression calibration = new SimpleRegression(true);
        SimpleRegression inverse = new SimpleRegression(true);
        for (int i = 0; i < n; i++) {
            calibration.addData(reference[i], signal[i]);
            inverse.addData(signal[i], reference[i]);
        }
        double slope = calibration.getSlope();
        double intercept = calibration.getIntercept();
        double rSquared = calibration.getRSquare();
        double squaredError = 0.0;
        for (int i = 0; i < n; i++) {
            predicted[i] = inverse.predict(signal[i]);
            double diff = predicted[i] - reference[i];
            squaredError += diff * diff;
        }
        double rmse = Math.sqrt(squaredError / n);

        double lod = Double.NaN;
        double loq = Double.NaN;
        LimitStatus status;
        if (!Double.isFinite(sigma)) {
            status = LimitStatus.UNDEFINED;
            logger.warn("Service: Curve '{}': noise estimate is not finite ({}), LoD/LoQ undefined.", label, sigma);
        } else if (slope == 0.0 || !Double.isFinite(slope)) {
            status = LimitStatus.UNDEFINED;
            logger.warn("Service: Curve '{}': slope is {}, LoD/LoQ undefined.", label, slope);
        } else if (sigma == 0.0) {
            status = LimitStatus.ZERO_NOISE;
            logger.warn("Service: Curve '{}': noise at the lowest reference is zero, LoD/LoQ not reported.", label);
        } else {
            lod = LOD_FACTOR * sigma / Math.abs(slope);
            loq = LOQ_FACTOR * sigma / Math.abs(slope);
            status = LimitStatus.DEFINED;
        }
        CalibrationCurve curve = new CalibrationCurve(label, request.referenceName(), request.parameter(), request.mode(),
                reference, signal, predicted, slope, intercept, inverse.getSlope(), inverse.getIntercept(),
                rSquared, rmse, sigma, lod, loq, status);
        logger.debug("Service: {}", curve);
        return curve;
    }

    /**
     * Smallest edge noise among the samples whose reference value is minimal.
     */
    static double lowestReferenceNoise(String element, List<IsolatedRegion> isolated, double[] reference) {
        IsolatedRegion region = isolated.stream()
                .filter(r -> r.getElement().equals(element))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No isolated region for element '" + element + "'."));
        if (region.getSampleCount() != reference.length) {
            throw new IllegalArgumentException(String.format("Isolated region '%s' has %d sample(s), reference has %d value(s).",
                    element, region.getSampleCount(), reference.length));
        }
        double minReference = StatUtils.min(reference);
        double sigma = Double.POSITIVE_INFINITY;
        for (int s = 0; s < reference.length; s++) {
            if (reference[s] == minReference) {
                sigma = Math.min(sigma, region.getNoise(s).min());
            }
        }
        return sigma;
    }

    private static String peakLabel(String element, int peak) {
        return element + " " + (peak + 1);
    }

    private static double[] column(double[][] values, int peak) {
        double[] column = new double[values.length];
        for (int s = 0; s < values.length; s++) {
            column[s] = values[s][peak];
        }
        return column;
    }

    private static double[] ratio(double[] numerator, double[] denominator) {
        double[] out = new double[numerator.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = numerator[i] / denominator[i];
        }
        return out;
    }

    /** Noise of b*o/(b+o); zero when either noise is zero. */
    static double equivalentNoise(double sigmaBase, double sigmaOther) {
        if (sigmaBase == 0.0 || sigmaOther == 0.0) {
            return 0.0;
        }
        return sigmaBase * sigmaOther / (sigmaBase + sigmaOther);
    }

    private static double[] equivalent(double[] base, double[] other) {
        double[] out = new double[base.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = base[i] * other[i] / (base[i] + other[i]);
        }
        return out;
    }
}
