package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Closed set of peak shapes available for fitting an element region.
 * Each constant knows its display label, how many parameters one peak takes in the
 * optimizer vector, whether the center is supplied externally and how the asymmetry is handled.
 *
 * <p>Parameter layout per peak (in order):
 * <ul>
 *   <li>Lorentzian / Gaussian: height, width, center</li>
 *   <li>Asymmetric Lorentzian: height, width, center, asymmetry</li>
 *   <li>Voigt: area, Lorentz width, Gauss width, center</li>
 * </ul>
 * Fixed-center variants drop the center, fixed-asymmetry variants drop the asymmetry.
 */
public enum PeakShape {
    LORENTZIAN("Lorentzian", 3, false, AsymmetryMode.NONE),
    LORENTZIAN_FIXED_CENTER("Lorentzian [center fixed]", 2, true, AsymmetryMode.NONE),
    ASYMMETRIC_LORENTZIAN("Asymmetric Lorentzian", 4, false, AsymmetryMode.FREE),
    ASYMMETRIC_LORENTZIAN_FIXED_CENTER("Asym. Lorentzian [center fixed]", 3, true, AsymmetryMode.FREE),
    ASYMMETRIC_LORENTZIAN_FIXED_CENTER_ASYMMETRY("Asym. Lorentzian [center/as. fixed]", 2, true, AsymmetryMode.FIXED),
    GAUSSIAN("Gaussian", 3, false, AsymmetryMode.NONE),
    GAUSSIAN_FIXED_CENTER("Gaussian [center fixed]", 2, true, AsymmetryMode.NONE),
    VOIGT("Voigt Profile", 4, false, AsymmetryMode.NONE),
    VOIGT_FIXED_CENTER("Voigt Profile [center fixed]", 3, true, AsymmetryMode.NONE),
    TRAPEZOIDAL("Trapezoidal rule", 3, false, AsymmetryMode.NONE); // sentinel: integrate, don't fit

    /** How the asymmetry of a shape enters the fit. */
    public enum AsymmetryMode { NONE, FREE, FIXED }

    private final String displayName;
    private final int parametersPerPeak;
    private final boolean centerFixed;
    private final AsymmetryMode asymmetryMode;

    PeakShape(String displayName, int parametersPerPeak, boolean centerFixed, AsymmetryMode asymmetryMode) {
        this.displayName = displayName;
        this.parametersPerPeak = parametersPerPeak;
        this.centerFixed = centerFixed;
        this.asymmetryMode = asymmetryMode;
    }

    public String getDisplayName() { return displayName; }
    public int getParametersPerPeak() { return parametersPerPeak; }
    public boolean isCenterFixed() { return centerFixed; }
    public AsymmetryMode getAsymmetryMode() { return asymmetryMode; }
    public boolean isAsymmetric() { return asymmetryMode != AsymmetryMode.NONE; }

    public boolean isLorentzianFamily() {
        return this == LORENTZIAN || this == LORENTZIAN_FIXED_CENTER || isAsymmetric();
    }

    public boolean isGaussian() { return this == GAUSSIAN || this == GAUSSIAN_FIXED_CENTER; }

    public boolean isVoigt() { return this == VOIGT || this == VOIGT_FIXED_CENTER; }

    /** True for the shape that reports the raw integral instead of running the optimizer. */
    public boolean isIntegrationOnly() { return this == TRAPEZOIDAL; }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Resolves a shape from its display label or its constant name (case-insensitive).
     *
     * @param label The label, e.g. {@code "Asym. Lorentzian [center fixed]"} or {@code "GAUSSIAN"}.
     * @return The matching shape.
     * @throws IllegalArgumentException If the label does not name a known shape.
     */
    public static PeakShape fromLabel(String label) {
        if (label == null || label.trim().isEmpty()) {
            throw new IllegalArgumentException("Peak shape label cannot be null or empty.");
        }
        String trimmed = label.trim();
        for (PeakShape shape : values()) {
            if (shape.displayName.equalsIgnoreCase(trimmed) || shape.name().equalsIgnoreCase(trimmed)) {
                return shape;
            }
        }
        throw new IllegalArgumentException("Unknown peak shape: '" + label + "'");
    }
}
