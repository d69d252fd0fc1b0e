package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.ShapeParams;

import java.util.Objects;

/**
 * Evaluates sum-of-peaks intensity curves for every {@link PeakShape}.
 * The parameter vector holds {@code peakCount * shape.getParametersPerPeak()} values laid out peak by peak;
 * heights and widths enter by absolute value.
 */
public final class PeakShapeModel {

    public static final double MIN_ASYMMETRY = 0.2;
    public static final double MAX_ASYMMETRY = 0.8;
    public static final double DEFAULT_ASYMMETRY = 0.5;

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);
    private static final double FWHM_TO_SIGMA = 2.0 * Math.sqrt(2.0 * Math.log(2.0));

    private PeakShapeModel() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** Number of peaks encoded in a parameter vector. */
    public static int peakCount(PeakShape shape, double[] params) {
        int perPeak = shape.getParametersPerPeak();
        if (params.length == 0 || params.length % perPeak != 0) {
            throw new IllegalArgumentException(String.format(
                    "Parameter vector of length %d does not fit shape '%s' (%d per peak).", params.length, shape, perPeak));
        }
        return params.length / perPeak;
    }

    /**
     * Sum of all peaks at every x.
     *
     * @throws IllegalStateException For the integration-only shape, which has no analytic form.
     */
    public static double[] evaluate(PeakShape shape, double[] x, double[] params, ShapeParams shapeParams) {
        int peaks = peakCount(shape, params);
        double[] y = new double[x.length];
        for (int p = 0; p < peaks; p++) {
            addPeak(shape, x, params, p, shapeParams, y);
        }
        return y;
    }

    /** Curve of a single peak of a multi-peak parameter vector. */
    public static double[] evaluatePeak(PeakShape shape, double[] x, double[] params, int peakIndex, ShapeParams shapeParams) {
        int peaks = peakCount(shape, params);
        if (peakIndex < 0 || peakIndex >= peaks) {
            throw new IndexOutOfBoundsException("Peak " + peakIndex + " outside 0.." + (peaks - 1));
        }
        double[] y = new double[x.length];
        addPeak(shape, x, params, peakIndex, shapeParams, y);
        return y;
    }

    /**
     * {@code observed - evaluate(...)}; all zeros for the integration-only shape.
     */
    public static double[] residuals(PeakShape shape, double[] x, double[] observed, double[] params, ShapeParams shapeParams) {
        if (observed.length != x.length) {
            throw new IllegalArgumentException("Observed and x lengths differ (" + observed.length + " vs " + x.length + ").");
        }
        if (shape.isIntegrationOnly()) {
            return new double[observed.length];
        }
        double[] model = evaluate(shape, x, params, shapeParams);
        double[] residual = new double[observed.length];
        for (int i = 0; i < observed.length; i++) {
            residual[i] = observed[i] - model[i];
        }
        return residual;
    }

    /** Asymmetry used by the model: values outside (0.2, 0.8) or NaN fall back to 0.5. */
    public static double effectiveAsymmetry(double m) {
        return (m > MIN_ASYMMETRY && m < MAX_ASYMMETRY) ? m : DEFAULT_ASYMMETRY;
    }

    private static void addPeak(PeakShape shape, double[] x, double[] params, int peak, ShapeParams shapeParams, double[] out) {
        Objects.requireNonNull(shapeParams, "Shape parameters cannot be null.");
        int o = peak * shape.getParametersPerPeak();
        switch (shape) {
            case LORENTZIAN:
                addLorentzian(x, params[o], params[o + 1], params[o + 2], out);
                break;
            case LORENTZIAN_FIXED_CENTER:
                addLorentzian(x, params[o], params[o + 1], shapeParams.centerOf(peak), out);
                break;
            case ASYMMETRIC_LORENTZIAN:
                addAsymmetricLorentzian(x, params[o], params[o + 1], params[o + 2], params[o + 3], out);
                break;
            case ASYMMETRIC_LORENTZIAN_FIXED_CENTER:
                addAsymmetricLorentzian(x, params[o], params[o + 1], shapeParams.centerOf(peak), params[o + 2], out);
                break;
            case ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY:
                addAsymmetricLorentzian(x, params[o], params[o + 1], shapeParams.centerOf(peak), shapeParams.fixedAsymmetry(), out);
                break;
            case GAUSSIAN:
                addGaussian(x, params[o], params[o + 1], params[o + 2], out);
                break;
            case GAUSSIAN_FIXED_CENTER:
                addGaussian(x, params[o], params[o + 1], shapeParams.centerOf(peak), out);
                break;
            case VOIGT:
                addVoigt(x, params[o], params[o + 1], params[o + 2], params[o + 3], out);
                break;
            case VOIGT_FIXED_CENTER:
                addVoigt(x, params[o], params[o + 1], params[o + 2], shapeParams.centerOf(peak), out);
                break;
            case TRAPEZOIDAL:
                throw new IllegalStateException("Shape '" + shape + "' is integrated numerically and has no model curve.");
            default:
                throw new IllegalStateException("Unhandled peak shape: " + shape);
        }
    }

    private static void addLorentzian(double[] x, double h, double w, double c, double[] out) {
        double height = Math.abs(h);
        double width = Math.abs(w);
        for (int i = 0; i < x.length; i++) {
            double u = (x[i] - c) / width;
            out[i] += height / (1.0 + 4.0 * u * u);
        }
    }

    // Half width w*m left of the center, w*(1-m) right of it
    private static void addAsymmetricLorentzian(double[] x, double h, double w, double c, double m, double[] out) {
        double height = Math.abs(h);
        double width = Math.abs(w);
        double asymmetry = effectiveAsymmetry(m);
        double left = width * asymmetry;
        double right = width * (1.0 - asymmetry);
        for (int i = 0; i < x.length; i++) {
            double halfWidth = x[i] < c ? left : right;
            double u = (x[i] - c) / halfWidth;
            out[i] += height / (1.0 + u * u);
        }
    }

    private static void addGaussian(double[] x, double h, double w, double c, double[] out) {
        double height = Math.abs(h);
        double width = Math.abs(w);
        for (int i = 0; i < x.length; i++) {
            double u = (x[i] - c) / width;
            out[i] += height * Math.exp(-2.0 * u * u);
        }
    }

    private static void addVoigt(double[] x, double a, double wl, double wg, double c, double[] out) {
        double area = Math.abs(a);
        double sigma = Math.abs(wg) / FWHM_TO_SIGMA;
        double gamma = Math.abs(wl) / 2.0;
        double scale = sigma * SQRT_2;
        for (int i = 0; i < x.length; i++) {
            out[i] += area * Faddeeva.realW((x[i] - c) / scale, gamma / scale) / (sigma * SQRT_2PI);
        }
    }
}
