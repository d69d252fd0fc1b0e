package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.model.IsolatedRegion;
import de.anton.libs.analyser.libs_analyzer.model.NoiseEstimate;
import de.anton.libs.analyser.libs_analyzer.model.ProgressListener;
import de.anton.libs.analyser.libs_analyzer.model.ProgressReporter;
import de.anton.libs.analyser.libs_analyzer.model.Region;
import de.anton.libs.analyser.libs_analyzer.model.RegionValidator;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumSet;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Crops full spectra to the element regions, optionally removes a linear baseline, and estimates
 * the per-sample noise of every window. Stateless; one progress unit is reported per region.
 */
public class RegionIsolationService {

    private static final Logger logger = LoggerFactory.getLogger(RegionIsolationService.class);

    /** Points taken from each end of the window to place the baseline. */
    static final int BASELINE_EDGE_POINTS = 2;

    /**
     * Isolates all regions.
     *
     * @param spectra  Full spectra.
     * @param regions  Region table, validated against the spectra before any work starts.
     * @param config   Baseline options.
     * @param listener Progress callback, may be null.
     * @return One isolated region per input region, in table order.
     * @throws IllegalArgumentException If the region table is invalid for these spectra.
     * @throws InterruptedException     If the calling thread is interrupted between regions.
     */
    public List<IsolatedRegion> isolate(SpectrumSet spectra, List<Region> regions, IsolationConfiguration config,
                                        ProgressListener listener) throws InterruptedException {
        Objects.requireNonNull(config, "Isolation configuration cannot be null.");
        RegionValidator.validate(regions, spectra);
        if (config.areaNormalize() && !config.baselineCorrect()) {
            logger.warn("Area normalization requested without baseline correction; it is ignored.");
        }
        logger.info("Service: Isolating {} region(s) from {} sample(s) (baseline={}, areaNorm={}).",
                regions.size(), spectra.getSampleCount(), config.baselineCorrect(), config.areaNormalize());

        ProgressReporter progress = new ProgressReporter(listener, regions.size());
        double[] wavelengths = spectra.getWavelengths();
        List<IsolatedRegion> isolated = new ArrayList<>(regions.size());
        for (Region region : regions) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Isolation cancelled before region " + region.getElement());
            }
            isolated.add(isolateRegion(spectra, wavelengths, region, config));
            progress.unitDone();
        }
        logger.info("Service: Isolation finished for {} region(s).", isolated.size());
        return Collections.unmodifiableList(isolated);
    }

    private IsolatedRegion isolateRegion(SpectrumSet spectra, double[] wavelengths, Region region, IsolationConfiguration config) {
        int[] indices = selectIndices(wavelengths, region);
        double[] x = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            x[i] = wavelengths[indices[i]];
        }

        List<double[][]> windows = new ArrayList<>(spectra.getSampleCount());
        List<NoiseEstimate> noise = new ArrayList<>(spectra.getSampleCount());
        for (int s = 0; s < spectra.getSampleCount(); s++) {
            double[][] full = spectra.getIntensities(s);
            double[][] window = new double[indices.length][];
            for (int i = 0; i < indices.length; i++) {
                window[i] = full[indices[i]].clone();
            }
            if (config.baselineCorrect()) {
                for (int k = 0; k < window[0].length; k++) {
                    correctShot(x, window, k, config.areaNormalize(), region.getElement());
                }
            }
            NoiseEstimate estimate = NoiseEstimate.of(SpectrumMath.rowMeans(window));
            logger.trace("Region {} sample {}: noise left={}, right={}", region.getElement(), s, estimate.left(), estimate.right());
            windows.add(window);
            noise.add(estimate);
        }
        logger.debug("Region {}: {} point(s) between {} and {} nm.", region.getElement(), x.length, x[0], x[x.length - 1]);
        return new IsolatedRegion(region, x, windows, noise);
    }

    /** Indices of all wavelengths with {@code lower <= lambda <= upper}. */
    static int[] selectIndices(double[] wavelengths, Region region) {
        int count = 0;
        for (double w : wavelengths) {
            if (region.contains(w)) count++;
        }
        int[] indices = new int[count];
        int c = 0;
        for (int i = 0; i < wavelengths.length; i++) {
            if (region.contains(wavelengths[i])) indices[c++] = i;
        }
        return indices;
    }

    // Line through the two leftmost and two rightmost points of the shot, subtracted in place.
    private void correctShot(double[] x, double[][] window, int shot, boolean areaNormalize, String element) {
        int n = x.length;
        SimpleRegression line = new SimpleRegression(true);
        for (int i = 0; i < Math.min(BASELINE_EDGE_POINTS, n); i++) {
            line.addData(x[i], window[i][shot]);
        }
        for (int i = Math.max(0, n - BASELINE_EDGE_POINTS); i < n; i++) {
            line.addData(x[i], window[i][shot]);
        }
        double slope = line.getSlope();
        double intercept = line.getIntercept();
        double[] baseline = new double[n];
        for (int i = 0; i < n; i++) {
            baseline[i] = intercept + slope * x[i];
            window[i][shot] -= baseline[i];
        }
        if (areaNormalize) {
            double area = SpectrumMath.trapezoid(baseline, x);
            if (area == 0.0) {
                logger.warn("Region {} shot {}: baseline area is zero, normalized values are not finite.", element, shot);
            }
            for (int i = 0; i < n; i++) {
                window[i][shot] /= area;
            }
        }
    }
}
