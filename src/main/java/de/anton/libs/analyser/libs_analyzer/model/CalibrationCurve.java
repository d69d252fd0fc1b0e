package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Objects;

/**
 * One linear calibration curve: the regression of a (possibly normalized) fitted peak value
 * against the reference concentrations, with detection and quantification limits.
 * <p>
 * {@code slope} and {@code intercept} describe {@code signal = intercept + slope * reference} and drive the limits.
 * The predicted references come from the inverse line, {@code predicted = predictionIntercept + predictionSlope * signal}.
 * This class is immutable.
 */
public final class CalibrationCurve {

    private final String label;          // e.g. "Fe 1 / Ca 2"
    private final String referenceName;
    private final FitParameter parameter;
    private final CalibrationMode mode;
    private final double[] reference;
    private final double[] signal;       // predictor per sample
    private final double[] predicted;    // reference predicted from the signal
    private final double slope;
    private final double intercept;
    private final double predictionSlope;
    private final double predictionIntercept;
    private final double rSquared;
    private final double rmse;
    private final double sigma;
    private final double lod;
    private final double loq;
    private final LimitStatus limitStatus;

    public CalibrationCurve(String label, String referenceName, FitParameter parameter, CalibrationMode mode,
                            double[] reference, double[] signal, double[] predicted,
                            double slope, double intercept, double predictionSlope, double predictionIntercept,
                            double rSquared, double rmse,
                            double sigma, double lod, double loq, LimitStatus limitStatus) {
        this.label = Objects.requireNonNull(label, "Curve label cannot be null.");
        this.referenceName = Objects.requireNonNull(referenceName, "Reference name cannot be null for " + label);
        this.parameter = Objects.requireNonNull(parameter, "Parameter cannot be null for " + label);
        this.mode = Objects.requireNonNull(mode, "Mode cannot be null for " + label);
        this.limitStatus = Objects.requireNonNull(limitStatus, "Limit status cannot be null for " + label);
        if (reference.length != signal.length || reference.length != predicted.length) {
            throw new IllegalArgumentException("Reference, signal and predicted vectors must have equal length for " + label);
        }
        this.reference = reference.clone();
        this.signal = signal.clone();
        this.predicted = predicted.clone();
        this.slope = slope;
        this.intercept = intercept;
        this.predictionSlope = predictionSlope;
        this.predictionIntercept = predictionIntercept;
        this.rSquared = rSquared;
        this.rmse = rmse;
        this.sigma = sigma;
        this.lod = lod;
        this.loq = loq;
    }

    // --- Getters ---
    public String getLabel() { return label; }
    public String getReferenceName() { return referenceName; }
    public FitParameter getParameter() { return parameter; }
    public CalibrationMode getMode() { return mode; }
    public double[] getReference() { return reference.clone(); }
    public double[] getSignal() { return signal.clone(); }
    public double[] getPredicted() { return predicted.clone(); }
    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }
    public double getPredictionSlope() { return predictionSlope; }
    public double getPredictionIntercept() { return predictionIntercept; }
    public double getRSquared() { return rSquared; }
    public double getRmse() { return rmse; }
    public double getSigma() { return sigma; }
    public double getLod() { return lod; }
    public double getLoq() { return loq; }
    public LimitStatus getLimitStatus() { return limitStatus; }
    public boolean hasDefinedLimits() { return limitStatus == LimitStatus.DEFINED; }

    @Override
    public String toString() {
        return String.format("CalibrationCurve[%s (%s, %s vs %s): slope=%.4g, intercept=%.4g, R²=%.4f, RMSE=%.4g, LoD=%.4g, LoQ=%.4g, %s]",
                label, mode, parameter, referenceName, slope, intercept, rSquared, rmse, lod, loq, limitStatus);
    }
}
