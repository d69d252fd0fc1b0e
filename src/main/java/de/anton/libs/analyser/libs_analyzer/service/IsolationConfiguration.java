package de.anton.libs.analyser.libs_analyzer.service;

/**
 * Immutable settings of a region isolation run.
 *
 * @param baselineCorrect Subtract the straight line through the two outermost points on each side of the window.
 * @param areaNormalize   Additionally divide by the integral of that line; only used together with baselineCorrect.
 */
public record IsolationConfiguration(boolean baselineCorrect, boolean areaNormalize) {

    /** No correction, values are cropped unmodified. */
    public static IsolationConfiguration defaults() {
        return new IsolationConfiguration(false, false);
    }

    public static IsolationConfiguration baselineCorrected(boolean areaNormalize) {
        return new IsolationConfiguration(true, areaNormalize);
    }
}
