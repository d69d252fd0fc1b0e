package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Fitted per-peak quantity used as calibration signal.
 */
public enum FitParameter {
    AREA("Area"),
    HEIGHT("Height"),
    WIDTH("Width");

    private final String displayName;

    FitParameter(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /** Selects this parameter's per-peak values from a fit result. */
    public double[] valuesOf(FitResult result) {
        switch (this) {
            case AREA:
                return result.getAreas();
            case HEIGHT:
                return result.getHeights();
            case WIDTH:
                return result.getWidths();
            default:
                throw new IllegalStateException("Unhandled fit parameter: " + this);
        }
    }
}
