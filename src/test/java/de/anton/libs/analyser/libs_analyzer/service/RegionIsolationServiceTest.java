package de.anton.libs.analyser.libs_analyzer.service;

import de.anton.libs.analyser.libs_analyzer.model.IsolatedRegion;
import de.anton.libs.analyser.libs_analyzer.model.NoiseEstimate;
import de.anton.libs.analyser.libs_analyzer.model.Region;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumSet;
import de.anton.libs.analyser.libs_analyzer.model.SyntheticSpectra;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RegionIsolationServiceTest {

    private static final double[] AXIS = SpectrumMath.linspace(240.0, 260.0, 201); // 0.1 nm steps

    private RegionIsolationService service;

    @BeforeEach
    void setUp() {
        service = new RegionIsolationService();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("should crop without modifying values when no baseline correction is requested")
    void shouldCropUnmodified() throws InterruptedException {
        SpectrumSet spectra = SyntheticSpectra.gaussianLines(AXIS, new double[]{100, 50}, 0.4, 248.3, 3, 1.0, 7L);
        Region fe = new Region("Fe", 247.5, 249.0, 248.3);

        List<IsolatedRegion> isolated = service.isolate(spectra, List.of(fe), IsolationConfiguration.defaults(), null);

        IsolatedRegion region = isolated.get(0);
        int[] indices = RegionIsolationService.selectIndices(AXIS, fe);
        assertThat(region.getWavelengths()).hasSize(indices.length);
        assertThat(region.getWavelengths()[0]).isGreaterThanOrEqualTo(247.5);
        assertThat(region.getWavelengths()[indices.length - 1]).isLessThanOrEqualTo(249.0);
        for (int s = 0; s < 2; s++) {
            double[][] full = spectra.getIntensities(s);
            double[][] window = region.getIntensities(s);
            for (int i = 0; i < indices.length; i++) {
                assertThat(window[i]).containsExactly(full[indices[i]]);
            }
        }
    }

    @Test
    @DisplayName("should remove a linear background completely")
    void shouldRemoveLinearBaseline() throws InterruptedException {
        SpectrumSet spectra = SyntheticSpectra.ramp(AXIS, 2, 2, -500.0, 2.5);

        IsolatedRegion region = service.isolate(spectra, List.of(new Region("Ca", 250.0, 252.0, 251.0)),
                IsolationConfiguration.baselineCorrected(false), null).get(0);

        for (double[] row : region.getIntensities(1)) {
            assertThat(row[0]).isCloseTo(0.0, within(1e-8));
            assertThat(row[1]).isCloseTo(0.0, within(1e-8));
        }
        assertThat(region.getNoise(0).min()).isCloseTo(0.0, within(1e-8));
    }

    @Test
    @DisplayName("should keep the peak above a sloped background")
    void shouldKeepPeakAboveBaseline() throws InterruptedException {
        double[][] matrix = new double[AXIS.length][1];
        for (int i = 0; i < AXIS.length; i++) {
            matrix[i][0] = 10.0 + 0.5 * (AXIS[i] - 240.0) + SyntheticSpectra.gaussian(AXIS[i], 40.0, 0.3, 250.0);
        }
        SpectrumSet spectra = SyntheticSpectra.single(AXIS, matrix);

        IsolatedRegion region = service.isolate(spectra, List.of(new Region("Mg", 248.0, 252.0, 250.0)),
                IsolationConfiguration.baselineCorrected(false), null).get(0);

        double[] mean = region.getMeanSpectrum(0);
        assertThat(SpectrumMath.max(mean)).isCloseTo(40.0, within(1e-6));
        assertThat(mean[0]).isCloseTo(0.0, within(1e-6));
        assertThat(mean[mean.length - 1]).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("should divide by the integral of the baseline when area normalization is on")
    void shouldNormalizeByBaselineArea() throws InterruptedException {
        double[][] matrix = new double[AXIS.length][1];
        for (int i = 0; i < AXIS.length; i++) {
            matrix[i][0] = 2.0 + SyntheticSpectra.gaussian(AXIS[i], 40.0, 0.3, 250.0);
        }
        SpectrumSet spectra = SyntheticSpectra.single(AXIS, matrix);
        Region mg = new Region("Mg", 248.0, 252.0, 250.0);

        IsolatedRegion corrected = service.isolate(spectra, List.of(mg),
                IsolationConfiguration.baselineCorrected(false), null).get(0);
        IsolatedRegion normalized = service.isolate(spectra, List.of(mg),
                IsolationConfiguration.baselineCorrected(true), null).get(0);

        // flat baseline of 2 over the window
        double[] x = corrected.getWavelengths();
        double baselineArea = 2.0 * (x[x.length - 1] - x[0]);
        assertThat(SpectrumMath.max(normalized.getMeanSpectrum(0)))
                .isCloseTo(SpectrumMath.max(corrected.getMeanSpectrum(0)) / baselineArea, within(1e-6));
    }

    @Test
    @DisplayName("should estimate zero noise for a constant window and ignore the shot order")
    void shouldEstimateNoise() throws InterruptedException {
        SpectrumSet flat = SyntheticSpectra.ramp(AXIS, 1, 3, 7.0, 0.0);
        NoiseEstimate zero = service.isolate(flat, List.of(new Region("Fe", 247.5, 249.0, 248.3)),
                IsolationConfiguration.defaults(), null).get(0).getNoise(0);
        assertThat(zero.left()).isZero();
        assertThat(zero.right()).isZero();

        SpectrumSet noisy = SyntheticSpectra.gaussianLines(AXIS, new double[]{100}, 0.4, 248.3, 4, 2.0, 11L);
        double[][] reversed = noisy.getIntensities(0);
        for (double[] row : reversed) {
            for (int k = 0; k < row.length / 2; k++) {
                double tmp = row[k];
                row[k] = row[row.length - 1 - k];
                row[row.length - 1 - k] = tmp;
            }
        }
        SpectrumSet shuffled = noisy.withIntensities(List.<double[][]>of(reversed));
        Region fe = new Region("Fe", 247.5, 249.0, 248.3);
        NoiseEstimate original = service.isolate(noisy, List.of(fe), IsolationConfiguration.defaults(), null).get(0).getNoise(0);
        NoiseEstimate reordered = service.isolate(shuffled, List.of(fe), IsolationConfiguration.defaults(), null).get(0).getNoise(0);

        assertThat(reordered.left()).isCloseTo(original.left(), within(1e-12));
        assertThat(reordered.right()).isCloseTo(original.right(), within(1e-12));
        assertThat(original.min()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("should validate the region table before doing any work")
    void shouldValidateFirst() {
        SpectrumSet spectra = SyntheticSpectra.ramp(AXIS, 1, 1, 0.0, 1.0);
        List<Integer> progress = new ArrayList<>();

        assertThatThrownBy(() -> service.isolate(spectra,
                List.of(new Region("Fe", 247.5, 249.0, 248.3), new Region("Na", 588.0, 590.0, 589.0)),
                IsolationConfiguration.defaults(), (done, total) -> progress.add(done)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Na");
        assertThat(progress).isEmpty();
    }

    @Test
    @DisplayName("should report one progress unit per region")
    void shouldReportProgressPerRegion() throws InterruptedException {
        SpectrumSet spectra = SyntheticSpectra.ramp(AXIS, 1, 1, 0.0, 1.0);
        List<String> progress = new ArrayList<>();

        service.isolate(spectra, List.of(new Region("Fe", 247.5, 249.0, 248.3), new Region("Ca", 250.0, 252.0, 251.0)),
                IsolationConfiguration.defaults(), (done, total) -> progress.add(done + "/" + total));

        assertThat(progress).containsExactly("1/2", "2/2");
    }

    @Test
    @DisplayName("should stop when the thread is interrupted")
    void shouldStopWhenInterrupted() {
        SpectrumSet spectra = SyntheticSpectra.ramp(AXIS, 1, 1, 0.0, 1.0);
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> service.isolate(spectra, List.of(new Region("Fe", 247.5, 249.0, 248.3)),
                IsolationConfiguration.defaults(), null))
                .isInstanceOf(InterruptedException.class);
    }
}
