package de.anton.libs.analyser.libs_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a region table against a spectrum set before any isolation work starts.
 */
public final class RegionValidator {

    private static final Logger logger = LoggerFactory.getLogger(RegionValidator.class);

    /** Fewest wavelength points a window must contain to be fitted and to yield a noise estimate. */
    public static final int MIN_WINDOW_POINTS = 2;

    private RegionValidator() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * @throws IllegalArgumentException If the table is empty, an element name repeats, a region reaches
     *                                  outside the spectrum range or its window holds fewer than two points.
     */
    public static void validate(List<Region> regions, SpectrumSet spectra) {
        if (spectra == null) {
            throw new IllegalArgumentException("Spectra cannot be null.");
        }
        if (regions == null || regions.isEmpty()) {
            throw new IllegalArgumentException("Region table is empty.");
        }
        double first = spectra.getFirstWavelength();
        double last = spectra.getLastWavelength();
        double[] wavelengths = spectra.getWavelengths();
        Set<String> seen = new HashSet<>();
        for (Region region : regions) {
            if (region == null) {
                throw new IllegalArgumentException("Region table contains a null entry.");
            }
            if (!seen.add(region.getElement())) {
                throw new IllegalArgumentException("Element '" + region.getElement() + "' appears more than once in the region table.");
            }
            if (region.getLower() < first || region.getUpper() > last) {
                throw new IllegalArgumentException(String.format(
                        "Region '%s' (%.4f-%.4f nm) lies outside the spectrum range %.4f-%.4f nm.",
                        region.getElement(), region.getLower(), region.getUpper(), first, last));
            }
            int points = 0;
            for (double wavelength : wavelengths) {
                if (region.contains(wavelength)) points++;
            }
            if (points < MIN_WINDOW_POINTS) {
                throw new IllegalArgumentException(String.format(
                        "Region '%s' contains %d wavelength point(s), at least %d are required.",
                        region.getElement(), points, MIN_WINDOW_POINTS));
            }
        }
        logger.debug("Validated {} region(s) against spectrum range {}-{} nm.", regions.size(), first, last);
    }
}
