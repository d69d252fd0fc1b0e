package de.anton.libs.analyser.libs_analyzer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeakShapeTest {

    @ParameterizedTest
    @EnumSource(PeakShape.class)
    @DisplayName("should resolve every shape from its display label and its constant name")
    void shouldResolveFromLabels(PeakShape shape) {
        assertThat(PeakShape.fromLabel(shape.getDisplayName())).isSameAs(shape);
        assertThat(PeakShape.fromLabel(shape.name().toLowerCase())).isSameAs(shape);
        assertThat(PeakShape.fromLabel("  " + shape.getDisplayName() + " ")).isSameAs(shape);
    }

    @Test
    @DisplayName("should reject unknown and blank labels")
    void shouldRejectUnknownLabels() {
        assertThatThrownBy(() -> PeakShape.fromLabel("Pseudo-Voigt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Pseudo-Voigt");
        assertThatThrownBy(() -> PeakShape.fromLabel(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PeakShape.fromLabel(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should declare the parameter layout of each shape")
    void shouldDeclareParameterLayout() {
        assertThat(PeakShape.LORENTZIAN.getParametersPerPeak()).isEqualTo(3);
        assertThat(PeakShape.LORENTZIAN_FIXED_CENTER.getParametersPerPeak()).isEqualTo(2);
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN.getParametersPerPeak()).isEqualTo(4);
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER.getParametersPerPeak()).isEqualTo(3);
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY.getParametersPerPeak()).isEqualTo(2);
        assertThat(PeakShape.VOIGT.getParametersPerPeak()).isEqualTo(4);
        assertThat(PeakShape.VOIGT_FIXED_CENTER.getParametersPerPeak()).isEqualTo(3);
    }

    @Test
    @DisplayName("should group shapes into families")
    void shouldGroupShapesIntoFamilies() {
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER.isLorentzianFamily()).isTrue();
        assertThat(PeakShape.GAUSSIAN_FIXED_CENTER.isGaussian()).isTrue();
        assertThat(PeakShape.VOIGT.isLorentzianFamily()).isFalse();
        assertThat(PeakShape.TRAPEZOIDAL.isIntegrationOnly()).isTrue();
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN.getAsymmetryMode()).isEqualTo(PeakShape.AsymmetryMode.FREE);
        assertThat(PeakShape.ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY.getAsymmetryMode()).isEqualTo(PeakShape.AsymmetryMode.FIXED);
    }
}
