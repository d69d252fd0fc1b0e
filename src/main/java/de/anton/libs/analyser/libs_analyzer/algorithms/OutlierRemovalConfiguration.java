package de.anton.libs.analyser.libs_analyzer.algorithms;

import java.util.Objects;

/**
 * Immutable settings of a shot outlier removal run.
 *
 * @param method    SAM (spectral angle mapper) or MAD (median absolute deviation).
 * @param criterion SAM: minimum cosine to the mean spectrum, within (0, 1].
 *                  MAD: maximum robust z-score, typically 2, 2.5 or 3.
 */
public record OutlierRemovalConfiguration(Method method, double criterion) {

    public enum Method {
        SAM("Spectral Angle Mapper"),
        MAD("Median Absolute Deviation");

        private final String displayName;

        Method(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    public OutlierRemovalConfiguration {
        Objects.requireNonNull(method, "Outlier removal method cannot be null.");
        if (Double.isNaN(criterion) || criterion <= 0) {
            throw new IllegalArgumentException("Outlier criterion must be positive. Got: " + criterion);
        }
        if (method == Method.SAM && criterion > 1.0) {
            throw new IllegalArgumentException("SAM criterion is a cosine and must not exceed 1. Got: " + criterion);
        }
    }

    public static OutlierRemovalConfiguration sam(double minCosine) {
        return new OutlierRemovalConfiguration(Method.SAM, minCosine);
    }

    public static OutlierRemovalConfiguration mad(double maxDeviation) {
        return new OutlierRemovalConfiguration(Method.MAD, maxDeviation);
    }
}
