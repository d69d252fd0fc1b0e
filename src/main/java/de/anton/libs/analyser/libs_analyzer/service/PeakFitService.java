package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.algorithms.GuessBuilder;
import de.anton.libs.analyser.libs_analyzer.algorithms.PeakFitter;
import de.anton.libs.analyser.libs_analyzer.algorithms.PeakShapeModel;
import de.anton.libs.analyser.libs_analyzer.model.CurveSet;
import de.anton.libs.analyser.libs_analyzer.model.FitResult;
import de.anton.libs.analyser.libs_analyzer.model.FitResults;
import de.anton.libs.analyser.libs_analyzer.model.FitStatus;
import de.anton.libs.analyser.libs_analyzer.model.IsolatedRegion;
import de.anton.libs.analyser.libs_analyzer.model.PeakMetrics;
import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.ProgressListener;
import de.anton.libs.analyser.libs_analyzer.model.ProgressReporter;
import de.anton.libs.analyser.libs_analyzer.model.ShapeParams;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fits the peak shapes of every isolated element region for every sample.
 * <p>
 * Each (element, sample) pair is one independent unit writing only its own slot of a pre-sized
 * {@link FitResults} arena, so units can run on a worker pool without locking. Failures are isolated
 * to their unit ({@link FitStatus#FAILED}); non-convergence is reported, never thrown. Cancellation is
 * cooperative: the interrupt flag is checked before every unit, never inside a solve.
 */
public class PeakFitService {

    private static final Logger logger = LoggerFactory.getLogger(PeakFitService.class);

    /** Points of the evenly spaced grid the fitted peak curves are evaluated on. */
    public static final int CURVE_POINTS = 1000;

    private static final double VOIGT_WL_FACTOR = 0.5346;
    private static final double VOIGT_WL2_FACTOR = 0.2166;

    /**
     * Fits all regions.
     *
     * @param regions  Isolated regions, all with the same sample count.
     * @param config   Shapes, asymmetries, aggregation mode, parallelism and solver settings.
     * @param listener Notified once per completed unit, may be null.
     * @return The complete result arena.
     * @throws IllegalArgumentException If regions and configuration do not match.
     * @throws InterruptedException     If the calling thread is interrupted; pending units are cancelled.
     */
    public FitResults fit(List<IsolatedRegion> regions, FitConfiguration config, ProgressListener listener) throws InterruptedException {
        Objects.requireNonNull(config, "Fit configuration cannot be null.");
        if (regions == null || regions.isEmpty()) {
            throw new IllegalArgumentException("No isolated regions to fit.");
        }
        if (config.shapeLabels().size() != regions.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d shape label(s) for %d region(s).", config.shapeLabels().size(), regions.size()));
        }
        int samples = regions.get(0).getSampleCount();
        List<String> elements = new ArrayList<>(regions.size());
        for (IsolatedRegion region : regions) {
            if (region.getSampleCount() != samples) {
                throw new IllegalArgumentException(String.format("Region '%s' has %d sample(s), expected %d.",
                        region.getElement(), region.getSampleCount(), samples));
            }
            elements.add(region.getElement());
        }

        FitResults results = new FitResults(elements, samples);
        PeakFitter fitter = config.createFitter();
        ProgressReporter progress = new ProgressReporter(listener, regions.size() * samples);
        logger.info("Service: Starting peak fit of {} element(s) x {} sample(s) (meanFirst={}, threads={}).",
                regions.size(), samples, config.meanFirst(), config.parallelism());
        long start = System.nanoTime();

        try {
            if (config.parallelism() == 1) {
                runInline(regions, config, fitter, results, progress);
            } else {
                runPooled(regions, config, fitter, results, progress);
            }
        } catch (InterruptedException e) {
            logger.info("Service: Peak fit interrupted after {} of {} unit(s).", progress.getCompleted(), progress.getTotal());
            throw e;
        }

        logger.info("Service: Peak fit finished in {} ms: {}", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), results.statusCounts());
        return results;
    }

    private void runInline(List<IsolatedRegion> regions, FitConfiguration config, PeakFitter fitter,
                           FitResults results, ProgressReporter progress) throws InterruptedException {
        for (int e = 0; e < regions.size(); e++) {
            for (int s = 0; s < results.getSampleCount(); s++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Peak fit cancelled before unit (" + regions.get(e).getElement() + ", " + s + ").");
                }
                runUnit(regions.get(e), e, s, config, fitter, results, progress);
            }
        }
    }

    private void runPooled(List<IsolatedRegion> regions, FitConfiguration config, PeakFitter fitter,
                           FitResults results, ProgressReporter progress) throws InterruptedException {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(), r -> {
            Thread t = new Thread(r, "peak-fit-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int e = 0; e < regions.size(); e++) {
                for (int s = 0; s < results.getSampleCount(); s++) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException("Peak fit cancelled while dispatching units.");
                    }
                    final int elementIndex = e;
                    final int sampleIndex = s;
                    futures.add(pool.submit(() -> {
                        if (Thread.currentThread().isInterrupted()) {
                            return null; // cancelled before start
                        }
                        runUnit(regions.get(elementIndex), elementIndex, sampleIndex, config, fitter, results, progress);
                        return null;
                    }));
                }
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException ex) {
                    // runUnit converts unit failures into FAILED slots, anything escaping is a programming error
                    throw new IllegalStateException("Peak fit worker failed unexpectedly.", ex.getCause());
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }

    private void runUnit(IsolatedRegion region, int elementIndex, int sampleIndex, FitConfiguration config,
                         PeakFitter fitter, FitResults results, ProgressReporter progress) {
        String label = config.shapeLabels().get(elementIndex);
        PeakShape shape = null;
        FitResult result;
        try {
            shape = PeakShape.fromLabel(label);
            double asymmetry = config.asymmetryOf(elementIndex);
            result = config.meanFirst()
                    ? fitMeanFirst(region, sampleIndex, shape, asymmetry, fitter)
                    : fitPerShot(region, sampleIndex, shape, asymmetry, fitter);
            logger.debug("Unit ({}, {}): {} after {} evaluation(s).", region.getElement(), sampleIndex, result.getStatus(), result.getEvaluations());
        } catch (RuntimeException ex) {
            logger.error("Unit ({}, {}) with shape '{}' failed: {}", region.getElement(), sampleIndex, label, ex.getMessage(), ex);
            result = FitResult.failed(region.getElement(), sampleIndex, shape, region.getPeakCount(), ex.getMessage());
        }
        results.set(elementIndex, sampleIndex, result);
        progress.unitDone();
    }

    private FitResult fitMeanFirst(IsolatedRegion region, int sampleIndex, PeakShape shape, double asymmetry, PeakFitter fitter) {
        double[] x = region.getWavelengths();
        double[] y = region.getMeanSpectrum(sampleIndex);
        SingleFit fit = fitSignal(region, shape, asymmetry, x, y, fitter);
        FitStatus status = fit.converged ? FitStatus.CONVERGED : FitStatus.NOT_CONVERGED;
        return new FitResult(region.getElement(), sampleIndex, shape, status, fit.evaluations, fit.converged ? 1.0 : 0.0,
                x, y, fit.residual, fit.curves, PeakMetrics.single(fit.heights, fit.widths, fit.areas), null);
    }

    private FitResult fitPerShot(IsolatedRegion region, int sampleIndex, PeakShape shape, double asymmetry, PeakFitter fitter) {
        double[] x = region.getWavelengths();
        double[][] matrix = region.getIntensities(sampleIndex);
        int shots = matrix[0].length;
        ShotAccumulator accumulator = new ShotAccumulator(shots);
        for (int k = 0; k < shots; k++) {
            double[] y = SpectrumMath.column(matrix, k);
            accumulator.add(y, fitSignal(region, shape, asymmetry, x, y, fitter));
        }
        return accumulator.finish(region.getElement(), sampleIndex, shape, x);
    }

    /** One solve (or one integration) of one signal. */
    private SingleFit fitSignal(IsolatedRegion region, PeakShape shape, double asymmetry, double[] x, double[] y, PeakFitter fitter) {
        int peaks = region.getPeakCount();
        double[] heights = new double[peaks];
        double[] widths = new double[peaks];
        double[] areas = new double[peaks];

        if (shape.isIntegrationOnly()) {
            Arrays.fill(heights, SpectrumMath.max(y));
            Arrays.fill(widths, (x[x.length - 1] - x[0]) / 4.0);
            Arrays.fill(areas, SpectrumMath.trapezoid(y, x));
            CurveSet curves = new CurveSet(x, new double[][]{y});
            return new SingleFit(new double[y.length], curves, heights, widths, areas, 1, true);
        }

        double[] centers = region.getRegion().getCenters();
        ShapeParams shapeParams = new ShapeParams(peaks, centers, asymmetry);
        double startAsymmetry = Double.isFinite(asymmetry) ? asymmetry : PeakShapeModel.DEFAULT_ASYMMETRY;
        double[] guess = GuessBuilder.guess(x, y, peaks, centers, shape, startAsymmetry);
        PeakFitter.Solution solution = fitter.solve(shape, x, y, guess, shapeParams);
        double[] params = solution.parameters();

        double[] residual = PeakShapeModel.residuals(shape, x, y, params, shapeParams);
        double[] grid = SpectrumMath.linspace(x[0], x[x.length - 1], CURVE_POINTS);
        double[][] peakCurves = new double[peaks][];
        int perPeak = shape.getParametersPerPeak();
        for (int p = 0; p < peaks; p++) {
            peakCurves[p] = PeakShapeModel.evaluatePeak(shape, grid, params, p, shapeParams);
            int o = p * perPeak;
            if (shape.isVoigt()) {
                double wl = params[o + 1];
                double wg = params[o + 2];
                widths[p] = VOIGT_WL_FACTOR * wl + Math.sqrt(VOIGT_WL2_FACTOR * wl * wl + wg * wg);
                heights[p] = SpectrumMath.max(peakCurves[p]);
                areas[p] = params[o];
            } else {
                heights[p] = params[o];
                widths[p] = params[o + 1];
                areas[p] = shape.isGaussian()
                        ? 2.0 * heights[p] * widths[p] * Math.sqrt(Math.PI / 2.0)
                        : heights[p] * widths[p] * Math.PI / 2.0;
            }
        }
        return new SingleFit(residual, new CurveSet(grid, peakCurves), heights, widths, areas,
                solution.evaluations(), solution.converged());
    }

    private static final class SingleFit {
        final double[] residual;
        final CurveSet curves;
        final double[] heights;
        final double[] widths;
        final double[] areas;
        final int evaluations;
        final boolean converged;

        SingleFit(double[] residual, CurveSet curves, double[] heights, double[] widths, double[] areas,
                  int evaluations, boolean converged) {
            this.residual = residual;
            this.curves = curves;
            this.heights = heights;
            this.widths = widths;
            this.areas = areas;
            this.evaluations = evaluations;
            this.converged = converged;
        }
    }

    /**
     * Running sums of one sample's per-shot fits. Scoped to a single unit and finalized once.
     */
    private static final class ShotAccumulator {
        private final int shots;
        private int added;
        private double[] observedSum;
        private double[] residualSum;
        private double[] grid;
        private double[][] curveSums;
        private final double[][] heights; // [shot][peak]
        private final double[][] widths;
        private final double[][] areas;
        private long evaluationSum;
        private int convergedShots;

        ShotAccumulator(int shots) {
            this.shots = shots;
            this.heights = new double[shots][];
            this.widths = new double[shots][];
            this.areas = new double[shots][];
        }

        void add(double[] observed, SingleFit fit) {
            if (added == 0) {
                observedSum = new double[observed.length];
                residualSum = new double[observed.length];
                grid = fit.curves.getGrid();
                curveSums = new double[fit.curves.getPeakCount()][grid.length];
            }
            for (int i = 0; i < observed.length; i++) {
                observedSum[i] += observed[i];
                residualSum[i] += fit.residual[i];
            }
            double[][] curves = fit.curves.getPeakCurves();
            for (int p = 0; p < curves.length; p++) {
                for (int i = 0; i < curves[p].length; i++) {
                    curveSums[p][i] += curves[p][i];
                }
            }
            heights[added] = fit.heights;
            widths[added] = fit.widths;
            areas[added] = fit.areas;
            evaluationSum += fit.evaluations;
            if (fit.converged) convergedShots++;
            added++;
        }

        FitResult finish(String element, int sampleIndex, PeakShape shape, double[] wavelengths) {
            if (added != shots) {
                throw new IllegalStateException("Accumulated " + added + " of " + shots + " shots.");
            }
            divide(observedSum, shots);
            divide(residualSum, shots);
            for (double[] curve : curveSums) {
                divide(curve, shots);
            }
            int peaks = heights[0].length;
            double[] hMean = new double[peaks], wMean = new double[peaks], aMean = new double[peaks];
            double[] hStd = new double[peaks], wStd = new double[peaks], aStd = new double[peaks];
            for (int p = 0; p < peaks; p++) {
                double[] h = columnOf(heights, p), w = columnOf(widths, p), a = columnOf(areas, p);
                hMean[p] = SpectrumMath.mean(h);
                wMean[p] = SpectrumMath.mean(w);
                aMean[p] = SpectrumMath.mean(a);
                hStd[p] = SpectrumMath.populationStd(h);
                wStd[p] = SpectrumMath.populationStd(w);
                aStd[p] = SpectrumMath.populationStd(a);
            }
            double convergence = (double) convergedShots / shots;
            FitStatus status = convergedShots == shots ? FitStatus.CONVERGED : FitStatus.NOT_CONVERGED;
            return new FitResult(element, sampleIndex, shape, status, (double) evaluationSum / shots, convergence,
                    wavelengths, observedSum, residualSum, new CurveSet(grid, curveSums),
                    new PeakMetrics(hMean, wMean, aMean, hStd, wStd, aStd), null);
        }

        private static double[] columnOf(double[][] rows, int column) {
            double[] values = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                values[i] = rows[i][column];
            }
            return values;
        }

        private static void divide(double[] values, int divisor) {
            for (int i = 0; i < values.length; i++) {
                values[i] /= divisor;
            }
        }
    }
}
