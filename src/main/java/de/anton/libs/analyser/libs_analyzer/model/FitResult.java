package de.anton.libs.analyser.libs_analyzer.model;

import java.util.Objects;

/**
 * Outcome of fitting one element region for one sample: solver diagnostics, observed and residual
 * curves on the isolated axis, the oversampled per-peak curve set and the per-peak metrics.
 * Immutable once produced.
 */
public final class FitResult {

    private final String element;
    private final int sampleIndex;
    private final PeakShape shape;      // null when the shape label could not be resolved
    private final FitStatus status;
    private final double evaluations;   // averaged over shots in per-shot mode
    private final double convergence;   // 0/1, or the converged fraction of the shots
    private final double[] wavelengths;
    private final double[] observed;
    private final double[] residual;
    private final CurveSet curves;
    private final PeakMetrics metrics;
    private final String failureMessage;

    public FitResult(String element, int sampleIndex, PeakShape shape, FitStatus status,
                     double evaluations, double convergence,
                     double[] wavelengths, double[] observed, double[] residual,
                     CurveSet curves, PeakMetrics metrics, String failureMessage) {
        this.element = Objects.requireNonNull(element, "Element cannot be null.");
        this.status = Objects.requireNonNull(status, "Status cannot be null for " + element);
        this.curves = Objects.requireNonNull(curves, "Curve set cannot be null for " + element);
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null for " + element);
        if (sampleIndex < 0) {
            throw new IllegalArgumentException("Sample index must not be negative. Got: " + sampleIndex);
        }
        if (!(convergence >= 0.0 && convergence <= 1.0) && status != FitStatus.FAILED) {
            throw new IllegalArgumentException(String.format(
                    "Convergence must lie in [0, 1] for %s/sample %d. Got: %f", element, sampleIndex, convergence));
        }
        if (observed.length != wavelengths.length || residual.length != wavelengths.length) {
            throw new IllegalArgumentException("Observed and residual curves must match the isolated axis for " + element);
        }
        this.sampleIndex = sampleIndex;
        this.shape = shape;
        this.evaluations = evaluations;
        this.convergence = convergence;
        this.wavelengths = wavelengths.clone();
        this.observed = observed.clone();
        this.residual = residual.clone();
        this.failureMessage = failureMessage;
    }

    /**
     * Result for a unit that could not be computed. All metrics are NaN, curves are empty.
     */
    public static FitResult failed(String element, int sampleIndex, PeakShape shape, int peakCount, String message) {
        return new FitResult(element, sampleIndex, shape, FitStatus.FAILED, 0.0, 0.0,
                new double[0], new double[0], new double[0],
                CurveSet.empty(), PeakMetrics.undefined(peakCount), message);
    }

    // --- Getters ---
    public String getElement() { return element; }
    public int getSampleIndex() { return sampleIndex; }
    public PeakShape getShape() { return shape; }
    public FitStatus getStatus() { return status; }
    public double getEvaluations() { return evaluations; }
    public double getConvergence() { return convergence; }
    public boolean isConverged() { return status == FitStatus.CONVERGED; }
    public boolean isFailed() { return status == FitStatus.FAILED; }
    public double[] getWavelengths() { return wavelengths.clone(); }
    public double[] getObserved() { return observed.clone(); }
    public double[] getResidual() { return residual.clone(); }
    public CurveSet getCurves() { return curves; }
    public PeakMetrics getMetrics() { return metrics; }
    public int getPeakCount() { return metrics.peakCount(); }
    public double[] getHeights() { return metrics.heights(); }
    public double[] getWidths() { return metrics.widths(); }
    public double[] getAreas() { return metrics.areas(); }
    public double[] getHeightStd() { return metrics.heightStd(); }
    public double[] getWidthStd() { return metrics.widthStd(); }
    public double[] getAreaStd() { return metrics.areaStd(); }
    public String getFailureMessage() { return failureMessage; }

    @Override
    public String toString() {
        return String.format("FitResult[Element='%s', Sample=%d, Shape=%s, Status=%s, Evaluations=%.1f, Convergence=%.2f, %s]",
                element, sampleIndex, shape, status, evaluations, convergence,
                status == FitStatus.FAILED ? "Failure='" + failureMessage + "'" : metrics.toString());
    }
}
