package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import de.anton.libs.analyser.libs_analyzer.model.ShapeParams;
import de.anton.libs.analyser.libs_analyzer.model.SpectrumMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;

class PeakFitterTest {

    private static final ShapeParams ONE_FREE = new ShapeParams(1, null, Double.NaN);

    private static double[] lorentzian(double[] x, double h, double w, double c) {
        return PeakShapeModel.evaluate(PeakShape.LORENTZIAN, x, new double[]{h, w, c}, ONE_FREE);
    }

    @Test
    @DisplayName("should recover a Lorentzian from its default guess")
    void shouldRecoverLorentzian() {
        double[] x = SpectrumMath.linspace(0.0, 10.0, 201);
        double[] y = lorentzian(x, 50.0, 1.2, 4.7);
        double[] start = GuessBuilder.guess(x, y, 1, new double[]{4.5}, PeakShape.LORENTZIAN, 0.5);

        PeakFitter.Solution solution = new PeakFitter().solve(PeakShape.LORENTZIAN, x, y, start, ONE_FREE);

        assertThat(solution.converged()).isTrue();
        assertThat(solution.evaluations()).isBetween(1, PeakFitter.DEFAULT_MAX_EVALUATIONS);
        double[] p = solution.parameters();
        assertThat(p[0]).isCloseTo(50.0, withinPercentage(1));
        assertThat(p[1]).isCloseTo(1.2, withinPercentage(1));
        assertThat(p[2]).isCloseTo(4.7, withinPercentage(1));
    }

    @Test
    @DisplayName("should fit two overlapping Gaussians with fixed centers")
    void shouldFitFixedCenterDoublet() {
        double[] x = SpectrumMath.linspace(0.0, 10.0, 301);
        ShapeParams centers = new ShapeParams(2, new double[]{4.0, 6.0}, Double.NaN);
        double[] y = PeakShapeModel.evaluate(PeakShape.GAUSSIAN_FIXED_CENTER, x, new double[]{30.0, 1.0, 15.0, 1.5}, centers);
        double[] start = GuessBuilder.guess(x, y, 2, new double[]{4.0, 6.0}, PeakShape.GAUSSIAN_FIXED_CENTER, 0.5);

        PeakFitter.Solution solution = new PeakFitter().solve(PeakShape.GAUSSIAN_FIXED_CENTER, x, y, start, centers);

        double[] p = solution.parameters();
        assertThat(solution.converged()).isTrue();
        assertThat(p[0]).isCloseTo(30.0, withinPercentage(1));
        assertThat(p[2]).isCloseTo(15.0, withinPercentage(1));
    }

    @Test
    @DisplayName("should report the last point instead of failing when the budget runs out")
    void shouldStopAtBudget() {
        double[] x = SpectrumMath.linspace(0.0, 10.0, 201);
        double[] y = lorentzian(x, 50.0, 1.2, 4.7);
        double[] start = {5.0, 4.0, 3.0};

        PeakFitter.Solution solution = new PeakFitter(1e-10, 1e-10, 1e-10, 2).solve(PeakShape.LORENTZIAN, x, y, start, ONE_FREE);

        assertThat(solution.converged()).isFalse();
        assertThat(solution.evaluations()).isEqualTo(2);
        assertThat(solution.parameters()).hasSize(3);
    }

    @Test
    @DisplayName("should return non-negative parameters")
    void shouldReturnAbsoluteParameters() {
        double[] x = SpectrumMath.linspace(0.0, 10.0, 101);
        double[] y = lorentzian(x, 20.0, 1.0, 5.0);

        PeakFitter.Solution solution = new PeakFitter().solve(PeakShape.LORENTZIAN, x, y, new double[]{-15.0, -2.0, 5.2}, ONE_FREE);

        for (double value : solution.parameters()) {
            assertThat(value).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    @DisplayName("should reject signals with non-finite values and the trapezoidal rule")
    void shouldRejectInvalidInput() {
        double[] x = {0, 1, 2};
        PeakFitter fitter = new PeakFitter();

        assertThatThrownBy(() -> fitter.solve(PeakShape.LORENTZIAN, x, new double[]{1, Double.NaN, 1}, new double[]{1, 1, 1}, ONE_FREE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-finite");
        assertThatThrownBy(() -> fitter.solve(PeakShape.TRAPEZOIDAL, x, new double[]{1, 2, 1}, new double[]{1, 1, 1}, ONE_FREE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fitter.solve(PeakShape.LORENTZIAN, x, new double[]{1, 2, 1}, new double[]{1, 1}, ONE_FREE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PeakFitter(0.0, 1e-7, 1e-7, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
