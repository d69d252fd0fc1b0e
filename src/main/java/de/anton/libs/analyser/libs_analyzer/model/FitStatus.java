package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Outcome of one (element, sample) fit unit.
 */
public enum FitStatus {
    /** Every solve of the unit met the tolerances. */
    CONVERGED,
    /** At least one solve stopped at the evaluation budget; results are still reported. */
    NOT_CONVERGED,
    /** The unit could not be computed (e.g. unknown shape); values are NaN. */
    FAILED
}
