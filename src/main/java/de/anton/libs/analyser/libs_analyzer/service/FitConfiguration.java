package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.algorithms.PeakFitter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of a peak fitting run. Shape labels and asymmetries are given per element,
 * in the order of the isolated regions.
 *
 * @param shapeLabels        Peak shape label per element (display label or constant name). Resolved per unit,
 *                           so an unknown label only fails its own element.
 * @param asymmetries        Asymmetry per element: the start value for free-asymmetry shapes, the fixed value for
 *                           fixed-asymmetry shapes. NaN means the model default.
 * @param meanFirst          Average the shots and fit once (true), or fit every shot and average the results (false).
 * @param parallelism        Number of worker threads, 1 runs inline on the calling thread.
 * @param costTolerance      Relative tolerance on the cost reduction.
 * @param parameterTolerance Relative tolerance on the parameter change.
 * @param orthoTolerance     Tolerance on the orthogonality between residual and Jacobian columns.
 * @param maxEvaluations     Evaluation budget of every single solve.
 */
public record FitConfiguration(
        List<String> shapeLabels,
        List<Double> asymmetries,
        boolean meanFirst,
        int parallelism,
        double costTolerance,
        double parameterTolerance,
        double orthoTolerance,
        int maxEvaluations
) {

    public FitConfiguration {
        Objects.requireNonNull(shapeLabels, "Shape labels cannot be null.");
        if (shapeLabels.isEmpty()) {
            throw new IllegalArgumentException("At least one shape label is required.");
        }
        shapeLabels = Collections.unmodifiableList(new ArrayList<>(shapeLabels));
        if (asymmetries == null) {
            Double[] unset = new Double[shapeLabels.size()];
            Arrays.fill(unset, Double.NaN);
            asymmetries = List.of(unset);
        } else if (asymmetries.size() != shapeLabels.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d asymmetries for %d shape labels.", asymmetries.size(), shapeLabels.size()));
        } else {
            asymmetries = Collections.unmodifiableList(new ArrayList<>(asymmetries));
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1. Got: " + parallelism);
        }
        if (!(costTolerance > 0) || !(parameterTolerance > 0) || !(orthoTolerance > 0)) {
            throw new IllegalArgumentException("Solver tolerances must be positive.");
        }
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("Max evaluations must be positive. Got: " + maxEvaluations);
        }
    }

    /** Mean-first, single thread, default tolerances (1e-7) and budget (1000 evaluations). */
    public static FitConfiguration forShapes(String... shapeLabels) {
        return defaults(Arrays.asList(shapeLabels));
    }

    public static FitConfiguration defaults(List<String> shapeLabels) {
        return new FitConfiguration(shapeLabels, null, true, 1,
                PeakFitter.DEFAULT_TOLERANCE, PeakFitter.DEFAULT_TOLERANCE, PeakFitter.DEFAULT_TOLERANCE,
                PeakFitter.DEFAULT_MAX_EVALUATIONS);
    }

    public FitConfiguration withAsymmetries(Double... values) {
        return new FitConfiguration(shapeLabels, Arrays.asList(values), meanFirst, parallelism,
                costTolerance, parameterTolerance, orthoTolerance, maxEvaluations);
    }

    public FitConfiguration withMeanFirst(boolean value) {
        return new FitConfiguration(shapeLabels, asymmetries, value, parallelism,
                costTolerance, parameterTolerance, orthoTolerance, maxEvaluations);
    }

    public FitConfiguration withParallelism(int threads) {
        return new FitConfiguration(shapeLabels, asymmetries, meanFirst, threads,
                costTolerance, parameterTolerance, orthoTolerance, maxEvaluations);
    }

    public FitConfiguration withMaxEvaluations(int budget) {
        return new FitConfiguration(shapeLabels, asymmetries, meanFirst, parallelism,
                costTolerance, parameterTolerance, orthoTolerance, budget);
    }

    /** Asymmetry configured for an element; NaN when unset. */
    public double asymmetryOf(int elementIndex) {
        Double value = asymmetries.get(elementIndex);
        return value == null ? Double.NaN : value;
    }

    /** A solver with this configuration's tolerances and budget. */
    public PeakFitter createFitter() {
        return new PeakFitter(costTolerance, parameterTolerance, orthoTolerance, maxEvaluations);
    }
}
