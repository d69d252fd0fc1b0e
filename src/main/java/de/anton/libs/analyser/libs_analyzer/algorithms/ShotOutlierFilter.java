package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.ProgressListener;
import de.anton.libs.analyser.libs_analyzer.model.ProgressReporter;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumSet;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Removes outlier shots from every sample of a spectrum set.
 * <ul>
 *   <li>SAM keeps a shot when the cosine between it and the sample's mean spectrum reaches the criterion.</li>
 *   <li>MAD computes, per wavelength, the median and {@code 1.4826 * median(|x - median|)}; a shot is kept when
 *       at least 95% of its points have a robust z-score below the criterion.</li>
 * </ul>
 */
public final class ShotOutlierFilter {

    private static final Logger logger = LoggerFactory.getLogger(ShotOutlierFilter.class);

    /** Scales the MAD to the standard deviation of normally distributed data. */
    public static final double MAD_SCALE = 1.4826;
    /** Fraction of a shot's points that must lie within the MAD criterion. */
    public static final double MAD_KEEP_FRACTION = 0.95;

    /** Filtered spectra and, per sample, how many of how many shots were removed. */
    public record OutlierRemovalResult(SpectrumSet filtered, int[] removedShots, int[] totalShots) {
        public OutlierRemovalResult {
            removedShots = removedShots.clone();
            totalShots = totalShots.clone();
        }

        @Override public int[] removedShots() { return removedShots.clone(); }
        @Override public int[] totalShots() { return totalShots.clone(); }

        @Override
        public String toString() {
            return "OutlierRemovalResult[removed=" + Arrays.toString(removedShots) + ", of=" + Arrays.toString(totalShots) + "]";
        }
    }

    private ShotOutlierFilter() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * @throws IllegalStateException If every shot of a sample would be removed.
     * @throws InterruptedException  If the calling thread is interrupted between samples.
     */
    public static OutlierRemovalResult filter(SpectrumSet spectra, OutlierRemovalConfiguration config,
                                              ProgressListener listener) throws InterruptedException {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(config, "Outlier configuration cannot be null.");
        logger.info("Starting {} outlier removal (criterion {}) for {} sample(s).",
                config.method(), config.criterion(), spectra.getSampleCount());
        ProgressReporter progress = new ProgressReporter(listener, spectra.getSampleCount());

        int samples = spectra.getSampleCount();
        List<double[][]> kept = new ArrayList<>(samples);
        int[] removed = new int[samples];
        int[] total = new int[samples];
        for (int s = 0; s < samples; s++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Outlier removal cancelled before sample " + s);
            }
            double[][] matrix = spectra.getIntensities(s);
            int shots = spectra.getShotCount(s);
            boolean[] keep = config.method() == OutlierRemovalConfiguration.Method.SAM
                    ? samKeep(matrix, config.criterion())
                    : madKeep(matrix, config.criterion());
            double[][] filtered = keepColumns(matrix, keep);
            int keptShots = filtered[0].length;
            if (keptShots == 0) {
                throw new IllegalStateException(String.format(
                        "Too few shots left in sample '%s' after %s outlier removal (criterion %s).",
                        spectra.getSampleNames().get(s), config.method().name(), config.criterion()));
            }
            removed[s] = shots - keptShots;
            total[s] = shots;
            kept.add(filtered);
            logger.debug("Sample '{}': removed {} of {} shot(s).", spectra.getSampleNames().get(s), removed[s], shots);
            progress.unitDone();
        }
        logger.info("Outlier removal finished, {} shot(s) removed in total.", Arrays.stream(removed).sum());
        return new OutlierRemovalResult(spectra.withIntensities(kept), removed, total);
    }

    static boolean[] samKeep(double[][] matrix, double minCosine) {
        double[] mean = SpectrumMath.rowMeans(matrix);
        int shots = matrix[0].length;
        boolean[] keep = new boolean[shots];
        double meanNorm = norm(mean);
        for (int k = 0; k < shots; k++) {
            double[] shot = SpectrumMath.column(matrix, k);
            double dot = 0.0;
            for (int i = 0; i < shot.length; i++) {
                dot += mean[i] * shot[i];
            }
            double cosine = dot / (meanNorm * norm(shot));
            keep[k] = cosine >= minCosine; // NaN (zero vector) is never kept
        }
        return keep;
    }

    static boolean[] madKeep(double[][] matrix, double maxDeviation) {
        int points = matrix.length;
        int shots = matrix[0].length;
        Median median = new Median();
        double[] medians = new double[points];
        double[] mads = new double[points];
        for (int i = 0; i < points; i++) {
            medians[i] = median.evaluate(matrix[i]);
            double[] deviations = new double[shots];
            for (int k = 0; k < shots; k++) {
                deviations[k] = FastMath.abs(matrix[i][k] - medians[i]);
            }
            mads[i] = MAD_SCALE * median.evaluate(deviations);
        }
        boolean[] keep = new boolean[shots];
        for (int k = 0; k < shots; k++) {
            int within = 0;
            for (int i = 0; i < points; i++) {
                double deviation = FastMath.abs(matrix[i][k] - medians[i]);
                // a zero MAD only tolerates values equal to the median
                boolean ok = mads[i] == 0.0 ? deviation == 0.0 : deviation / mads[i] < maxDeviation;
                if (ok) within++;
            }
            keep[k] = (double) within / points >= MAD_KEEP_FRACTION;
        }
        return keep;
    }

    private static double[][] keepColumns(double[][] matrix, boolean[] keep) {
        int count = 0;
        for (boolean k : keep) {
            if (k) count++;
        }
        double[][] out = new double[matrix.length][count];
        for (int i = 0; i < matrix.length; i++) {
            int c = 0;
            for (int k = 0; k < keep.length; k++) {
                if (keep[k]) out[i][c++] = matrix[i][k];
            }
        }
        return out;
    }

    private static double norm(double[] v) {
        double sum = 0.0;
        for (double value : v) {
            sum += value * value;
        }
        return FastMath.sqrt(sum);
    }
}
