package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.ShapeParams;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one Levenberg-Marquardt (Moré trust-region) least-squares solve of a peak shape against a signal.
 * The Jacobian is approximated by forward differences. Parameters are kept non-negative, so the
 * returned vector holds absolute values. Instances are immutable and may be shared between threads;
 * all solver state is local to {@link #solve}.
 */
public final class PeakFitter {

    private static final Logger logger = LoggerFactory.getLogger(PeakFitter.class);

    public static final double DEFAULT_TOLERANCE = 1e-7;
    public static final int DEFAULT_MAX_EVALUATIONS = 1000;

    private static final double DIFF_STEP = Math.sqrt(Math.ulp(1.0));

    private final double costTolerance;
    private final double parameterTolerance;
    private final double orthoTolerance;
    private final int maxEvaluations;

    /** Result of a single solve. */
    public record Solution(double[] parameters, int evaluations, boolean converged) {
        public Solution {
            parameters = parameters.clone();
        }

        @Override
        public double[] parameters() {
            return parameters.clone();
        }
    }

    public PeakFitter() {
        this(DEFAULT_TOLERANCE, DEFAULT_TOLERANCE, DEFAULT_TOLERANCE, DEFAULT_MAX_EVALUATIONS);
    }

    public PeakFitter(double costTolerance, double parameterTolerance, double orthoTolerance, int maxEvaluations) {
        if (!(costTolerance > 0) || !(parameterTolerance > 0) || !(orthoTolerance > 0)) {
            throw new IllegalArgumentException("Solver tolerances must be positive.");
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("Max evaluations must be positive. Got: " + maxEvaluations);
        }
        this.costTolerance = costTolerance;
        this.parameterTolerance = parameterTolerance;
        this.orthoTolerance = orthoTolerance;
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * Minimizes {@code y - model(x, p)} starting from {@code start}.
     * Hitting the evaluation budget is not an error: the last evaluated point is returned as not converged.
     *
     * @throws IllegalArgumentException If the signal contains non-finite values or the start vector does not fit the shape.
     */
    public Solution solve(PeakShape shape, double[] x, double[] y, double[] start, ShapeParams shapeParams) {
        Objects.requireNonNull(shape, "Shape cannot be null.");
        if (shape.isIntegrationOnly()) {
            throw new IllegalArgumentException("Shape '" + shape + "' is not fitted.");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y lengths differ (" + x.length + " vs " + y.length + ").");
        }
        for (double value : y) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Signal contains non-finite values.");
            }
        }
        PeakShapeModel.peakCount(shape, start);

        ShapeFunction model = new ShapeFunction(shape, x, shapeParams, start);
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .target(y)
                .model(model)
                .parameterValidator(NON_NEGATIVE)
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(Integer.MAX_VALUE)
                .build();
        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(costTolerance)
                .withParameterRelativeTolerance(parameterTolerance)
                .withOrthoTolerance(orthoTolerance);

        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            logger.trace("Solve of {} converged after {} evaluations, RMS {}", shape, optimum.getEvaluations(), optimum.getRMS());
            return new Solution(absolute(optimum.getPoint().toArray()), optimum.getEvaluations(), true);
        } catch (TooManyEvaluationsException e) {
            logger.debug("Solve of {} stopped at the evaluation budget ({}).", shape, maxEvaluations);
            return new Solution(absolute(model.lastPoint()), maxEvaluations, false);
        } catch (ConvergenceException e) {
            // tolerances below machine precision: no further reduction is possible at the last point
            logger.debug("Solve of {} reached machine precision: {}", shape, e.getMessage());
            return new Solution(absolute(model.lastPoint()), model.calls(), true);
        }
    }

    public double getCostTolerance() { return costTolerance; }
    public double getParameterTolerance() { return parameterTolerance; }
    public double getOrthoTolerance() { return orthoTolerance; }
    public int getMaxEvaluations() { return maxEvaluations; }

    private static double[] absolute(double[] values) {
        double[] abs = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            abs[i] = Math.abs(values[i]);
        }
        return abs;
    }

    /** Folds every parameter onto its absolute value; exact zeros move to the smallest normal double. */
    private static final ParameterValidator NON_NEGATIVE = params -> {
        for (int i = 0; i < params.getDimension(); i++) {
            double value = Math.abs(params.getEntry(i));
            params.setEntry(i, value == 0.0 ? Double.MIN_NORMAL : value);
        }
        return params;
    };

    /**
     * Model values and forward-difference Jacobian of a peak shape. Remembers the last point it was
     * evaluated at, so a solve cut off by the evaluation budget can still report it.
     */
    private static final class ShapeFunction implements MultivariateJacobianFunction {

        private final PeakShape shape;
        private final double[] x;
        private final ShapeParams shapeParams;
        private double[] lastPoint;
        private int calls;

        ShapeFunction(PeakShape shape, double[] x, ShapeParams shapeParams, double[] start) {
            this.shape = shape;
            this.x = x;
            this.shapeParams = shapeParams;
            this.lastPoint = start.clone();
        }

        @Override
        public Pair<RealVector, RealMatrix> value(RealVector point) {
            double[] p = point.toArray();
            lastPoint = p.clone();
            calls++;
            double[] values = PeakShapeModel.evaluate(shape, x, p, shapeParams);
            double[][] jacobian = new double[x.length][p.length];
            for (int j = 0; j < p.length; j++) {
                double[] stepped = p.clone();
                stepped[j] = p[j] + DIFF_STEP * Math.max(1.0, Math.abs(p[j]));
                double h = stepped[j] - p[j];
                double[] shifted = PeakShapeModel.evaluate(shape, x, stepped, shapeParams);
                for (int i = 0; i < x.length; i++) {
                    jacobian[i][j] = (shifted[i] - values[i]) / h;
                }
            }
            return new Pair<>(new ArrayRealVector(values, false), new Array2DRowRealMatrix(jacobian, false));
        }

        double[] lastPoint() { return lastPoint; }
        int calls() { return calls; }
    }
}
