package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Normalization applied to the base peak before regressing it against the reference values.
 */
public enum CalibrationMode {
    NO_NORM("No Norm"),                 // base value as is
    PEAK_NORM("Peak Norm"),             // base / normalizer peak
    ALL_NORM("All Norm"),               // base / every other element peak, one curve each
    EQUIVALENT_PEAK("Equivalent Peak"); // (base * other) / (base + other), one curve each

    private final String displayName;

    CalibrationMode(String displayName) {
        this.displayName = displayName;
    }

    /** True for the modes that produce one curve per peak of every other element. */
    public boolean isPerOtherPeak() {
        return this == ALL_NORM || this == EQUIVALENT_PEAK;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
