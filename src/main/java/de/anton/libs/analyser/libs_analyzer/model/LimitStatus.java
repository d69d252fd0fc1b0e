package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Whether the detection and quantification limits of a calibration curve could be computed.
 */
public enum LimitStatus {
    /** LoD and LoQ are finite. */
    DEFINED,
    /** The noise at the lowest reference is exactly zero; the limits are NaN. */
    ZERO_NOISE,
    /** Noise not finite, slope zero or not finite, or the predictor contains non-finite values. */
    UNDEFINED
}
