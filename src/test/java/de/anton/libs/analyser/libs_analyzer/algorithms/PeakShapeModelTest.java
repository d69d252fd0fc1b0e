package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.ShapeParams;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PeakShapeModelTest {

    private static final ShapeParams ONE_FREE = new ShapeParams(1, null, Double.NaN);

    @Nested
    @DisplayName("Lorentzian")
    class Lorentzian {

        @Test
        @DisplayName("should reach the height at the center and half of it at c +- w/2")
        void shouldUseFullWidthAtHalfMaximum() {
            double[] y = PeakShapeModel.evaluate(PeakShape.LORENTZIAN, new double[]{4.0, 5.0, 6.0},
                    new double[]{10.0, 2.0, 5.0}, ONE_FREE);

            assertThat(y[1]).isCloseTo(10.0, within(1e-12));
            assertThat(y[0]).isCloseTo(5.0, within(1e-12));
            assertThat(y[2]).isCloseTo(5.0, within(1e-12));
        }

        @Test
        @DisplayName("should use absolute heights and widths")
        void shouldUseAbsoluteValues() {
            double[] x = {4.0, 5.0, 6.5};
            double[] positive = PeakShapeModel.evaluate(PeakShape.LORENTZIAN, x, new double[]{10.0, 2.0, 5.0}, ONE_FREE);
            double[] negative = PeakShapeModel.evaluate(PeakShape.LORENTZIAN, x, new double[]{-10.0, -2.0, 5.0}, ONE_FREE);

            assertThat(negative).containsExactly(positive);
        }

        @Test
        @DisplayName("should read the center from the shape parameters when it is fixed")
        void shouldUseFixedCenter() {
            ShapeParams fixed = new ShapeParams(1, new double[]{5.0}, Double.NaN);

            double[] y = PeakShapeModel.evaluate(PeakShape.LORENTZIAN_FIXED_CENTER, new double[]{5.0}, new double[]{7.0, 1.0}, fixed);

            assertThat(y[0]).isCloseTo(7.0, within(1e-12));
            assertThatThrownBy(() -> PeakShapeModel.evaluate(PeakShape.LORENTZIAN_FIXED_CENTER, new double[]{5.0},
                    new double[]{7.0, 1.0}, ONE_FREE))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Asymmetric Lorentzian")
    class AsymmetricLorentzian {

        @Test
        @DisplayName("should split the width by the asymmetry around the center")
        void shouldSplitWidth() {
            // w = 1, m = 0.3: half maximum at c - 0.3 and c + 0.7
            double[] y = PeakShapeModel.evaluate(PeakShape.ASYMMETRIC_LORENTZIAN, new double[]{9.7, 10.0, 10.7},
                    new double[]{8.0, 1.0, 10.0, 0.3}, ONE_FREE);

            assertThat(y[0]).isCloseTo(4.0, within(1e-12));
            assertThat(y[1]).isCloseTo(8.0, within(1e-12));
            assertThat(y[2]).isCloseTo(4.0, within(1e-12));
        }

        @Test
        @DisplayName("should use the shared asymmetry when center and asymmetry are fixed")
        void shouldUseFixedAsymmetry() {
            ShapeParams fixed = new ShapeParams(1, new double[]{10.0}, 0.3);

            double[] y = PeakShapeModel.evaluate(PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY,
                    new double[]{9.7, 10.7}, new double[]{8.0, 1.0}, fixed);

            assertThat(y[0]).isCloseTo(4.0, within(1e-12));
            assertThat(y[1]).isCloseTo(4.0, within(1e-12));
        }

        @Test
        @DisplayName("should fall back to 0.5 outside (0.2, 0.8)")
        void shouldFallBackToSymmetric() {
            assertThat(PeakShapeModel.effectiveAsymmetry(0.3)).isEqualTo(0.3);
            assertThat(PeakShapeModel.effectiveAsymmetry(0.2)).isEqualTo(0.5);
            assertThat(PeakShapeModel.effectiveAsymmetry(0.95)).isEqualTo(0.5);
            assertThat(PeakShapeModel.effectiveAsymmetry(Double.NaN)).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("Gaussian and Voigt")
    class GaussianAndVoigt {

        @Test
        @DisplayName("should evaluate the Gaussian as h exp(-2 ((x - c)/w)^2)")
        void shouldEvaluateGaussian() {
            double[] y = PeakShapeModel.evaluate(PeakShape.GAUSSIAN, new double[]{2.0, 2.5},
                    new double[]{3.0, 1.0, 2.0}, ONE_FREE);

            assertThat(y[0]).isCloseTo(3.0, within(1e-12));
            assertThat(y[1]).isCloseTo(3.0 * Math.exp(-0.5), within(1e-12));
        }

        @Test
        @DisplayName("should integrate a Voigt profile to its area parameter")
        void shouldIntegrateVoigtToArea() {
            double[] x = SpectrumMath.linspace(-50.0, 50.0, 100001);

            double[] y = PeakShapeModel.evaluate(PeakShape.VOIGT, x, new double[]{2.0, 0.1, 0.2, 0.0}, ONE_FREE);

            assertThat(SpectrumMath.trapezoid(y, x)).isCloseTo(2.0, within(0.01));
        }

        @Test
        @DisplayName("should approach an area-normalized Gaussian for a vanishing Lorentz width")
        void shouldApproachGaussian() {
            double wg = 0.5;
            double sigma = wg / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));
            double[] x = {0.0, 0.2};

            double[] y = PeakShapeModel.evaluate(PeakShape.VOIGT, x, new double[]{1.0, 1e-9, wg, 0.0}, ONE_FREE);

            for (int i = 0; i < x.length; i++) {
                double gauss = Math.exp(-x[i] * x[i] / (2 * sigma * sigma)) / (sigma * Math.sqrt(2 * Math.PI));
                assertThat(y[i]).isCloseTo(gauss, within(1e-6));
            }
        }
    }

    @Test
    @DisplayName("should sum the peaks of a multi-peak vector")
    void shouldSumPeaks() {
        double[] x = SpectrumMath.linspace(0, 10, 11);
        double[] params = {5.0, 1.0, 3.0, 2.0, 1.5, 7.0};
        ShapeParams two = new ShapeParams(2, null, Double.NaN);

        double[] total = PeakShapeModel.evaluate(PeakShape.GAUSSIAN, x, params, two);
        double[] first = PeakShapeModel.evaluatePeak(PeakShape.GAUSSIAN, x, params, 0, two);
        double[] second = PeakShapeModel.evaluatePeak(PeakShape.GAUSSIAN, x, params, 1, two);

        for (int i = 0; i < x.length; i++) {
            assertThat(total[i]).isCloseTo(first[i] + second[i], within(1e-12));
        }
    }

    @Test
    @DisplayName("should reject vectors that do not fit the shape")
    void shouldRejectBadLength() {
        assertThatThrownBy(() -> PeakShapeModel.evaluate(PeakShape.GAUSSIAN, new double[]{1}, new double[]{1, 2}, ONE_FREE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should have no model curve for the trapezoidal rule but zero residuals")
    void shouldHandleTrapezoid() {
        double[] x = {1, 2, 3};

        assertThatThrownBy(() -> PeakShapeModel.evaluate(PeakShape.TRAPEZOIDAL, x, new double[]{1, 1, 1}, ONE_FREE))
                .isInstanceOf(IllegalStateException.class);
        assertThat(PeakShapeModel.residuals(PeakShape.TRAPEZOIDAL, x, new double[]{4, 5, 6}, new double[]{1, 1, 1}, ONE_FREE))
                .containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("should compute residuals as observed minus model")
    void shouldComputeResiduals() {
        double[] x = {5.0};

        double[] residual = PeakShapeModel.residuals(PeakShape.LORENTZIAN, x, new double[]{12.0}, new double[]{10.0, 2.0, 5.0}, ONE_FREE);

        assertThat(residual[0]).isCloseTo(2.0, within(1e-12));
    }
}
