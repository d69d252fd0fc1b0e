package de.anton.libs.analyser.libs_analyzer.algorithms;

import de.anton.libs.analyser.libs_analyzer.model.PeakShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GuessBuilderTest {

    private static final double[] X = {0.0, 1.0, 2.0, 3.0, 4.0};
    private static final double[] Y = {1.0, 4.0, 10.0, 6.0, 2.0};

    @Test
    @DisplayName("should start later peaks smaller for the Lorentzian layout")
    void shouldScaleLaterPeaks() {
        double[] guess = GuessBuilder.guess(X, Y, 2, new double[]{1.5, 2.5}, PeakShape.LORENTZIAN, 0.5);

        assertThat(guess).hasSize(6);
        assertThat(guess).containsExactly(new double[]{10.0, 1.0, 1.5, 8.0, 0.8, 2.5}, within(1e-12));
    }

    @Test
    @DisplayName("should start a Voigt peak with a triangle area and two equal widths")
    void shouldGuessVoigt() {
        double[] guess = GuessBuilder.guess(X, Y, 1, new double[]{2.0}, PeakShape.VOIGT, 0.5);

        assertThat(guess).containsExactly(new double[]{20.0, 1.0, 1.0, 2.0}, within(1e-12));
    }

    @Test
    @DisplayName("should drop fixed centers and append a free asymmetry")
    void shouldFollowAsymmetryLayouts() {
        double[] free = GuessBuilder.guess(X, Y, 1, new double[]{2.0}, PeakShape.ASYMMETRIC_LORENTZIAN, 0.4);
        double[] centerFixed = GuessBuilder.guess(X, Y, 1, new double[]{2.0}, PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER, 0.4);
        double[] allFixed = GuessBuilder.guess(X, Y, 1, new double[]{2.0}, PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY, 0.4);
        double[] voigtFixed = GuessBuilder.guess(X, Y, 1, new double[]{2.0}, PeakShape.VOIGT_FIXED_CENTER, 0.4);

        assertThat(free).containsExactly(new double[]{10.0, 1.0, 2.0, 0.4}, within(1e-12));
        assertThat(centerFixed).containsExactly(new double[]{10.0, 1.0, 0.4}, within(1e-12));
        assertThat(allFixed).containsExactly(new double[]{10.0, 1.0}, within(1e-12));
        assertThat(voigtFixed).hasSize(3);
    }

    @Test
    @DisplayName("should reject missing centers")
    void shouldRejectMissingCenters() {
        assertThatThrownBy(() -> GuessBuilder.guess(X, Y, 2, new double[]{1.0}, PeakShape.GAUSSIAN, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
