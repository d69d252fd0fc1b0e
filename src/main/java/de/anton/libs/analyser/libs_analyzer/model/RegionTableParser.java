package de.anton.libs.analyser.libs_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns raw region table rows into {@link Region}s.
 * A row holds {@code element, lower, upper, centers[, peaks]}; several centers are joined with {@code ';'}.
 * Numbers may use a comma as decimal separator. The peak count column is optional and defaults to
 * the number of centers.
 */
public final class RegionTableParser {

    private static final Logger logger = LoggerFactory.getLogger(RegionTableParser.class);

    public static final String CENTER_SEPARATOR = ";";

    private static final int COL_ELEMENT = 0;
    private static final int COL_LOWER = 1;
    private static final int COL_UPPER = 2;
    private static final int COL_CENTERS = 3;
    private static final int COL_PEAKS = 4;

    private RegionTableParser() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Parses all rows. Completely blank rows are skipped.
     *
     * @param rows Table rows, each a String array in column order.
     * @return The parsed regions in row order.
     * @throws IllegalArgumentException If a row is incomplete, a number cannot be parsed or
     *                                  a region violates its own invariants.
     */
    public static List<Region> parse(List<String[]> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Region table cannot be null.");
        }
        List<Region> regions = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlank(row)) {
                logger.trace("Skipping blank region table row {}", i + 1);
                continue;
            }
            regions.add(parseRow(row, i + 1));
        }
        logger.debug("Parsed {} region(s) from {} table row(s).", regions.size(), rows.size());
        return Collections.unmodifiableList(regions);
    }

    private static Region parseRow(String[] row, int rowNumber) {
        if (row.length <= COL_CENTERS) {
            throw new IllegalArgumentException(String.format(
                    "Region table row %d is incomplete: expected element, lower, upper and centers, got %d column(s).",
                    rowNumber, row.length));
        }
        String element = row[COL_ELEMENT] == null ? "" : row[COL_ELEMENT].trim();
        if (element.isEmpty()) {
            throw new IllegalArgumentException("Region table row " + rowNumber + ": element name is empty.");
        }
        double lower = requireNumber(row[COL_LOWER], "lower bound", element, rowNumber);
        double upper = requireNumber(row[COL_UPPER], "upper bound", element, rowNumber);
        double[] centers = parseCenters(row[COL_CENTERS], element, rowNumber);

        int peaks = centers.length;
        if (row.length > COL_PEAKS && row[COL_PEAKS] != null && !row[COL_PEAKS].trim().isEmpty()) {
            double declared = requireNumber(row[COL_PEAKS], "peak count", element, rowNumber);
            if (declared != Math.rint(declared)) {
                throw new IllegalArgumentException(String.format(
                        "Region table row %d (%s): peak count must be an integer. Got: %s", rowNumber, element, row[COL_PEAKS]));
            }
            peaks = (int) declared;
        }
        try {
            return new Region(element, lower, upper, centers, peaks);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Region table row " + rowNumber + ": " + e.getMessage(), e);
        }
    }

    private static double[] parseCenters(String value, String element, int rowNumber) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(String.format("Region table row %d (%s): no center given.", rowNumber, element));
        }
        String[] parts = value.split(CENTER_SEPARATOR);
        List<Double> centers = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.trim().isEmpty()) continue; // trailing separator
            centers.add(requireNumber(part, "center", element, rowNumber));
        }
        return centers.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double requireNumber(String value, String what, String element, int rowNumber) {
        double parsed = parseDouble(value);
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException(String.format(
                    "Region table row %d (%s): %s '%s' is not a number.", rowNumber, element, what, value));
        }
        return parsed;
    }

    /**
     * Parses a string into a double, accepting a comma as decimal separator.
     *
     * @return The parsed value, or NaN if the input is null, empty, "-" or not numeric.
     */
    static double parseDouble(String value) {
        if (value == null || value.trim().isEmpty() || value.trim().equals("-")) {
            return Double.NaN;
        }
        String cleaned = value.trim().replace(',', '.');
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            logger.trace("Could not parse double from '{}': {}", value, e.getMessage());
            return Double.NaN;
        }
    }

    private static boolean isBlank(String[] row) {
        if (row == null) return true;
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) return false;
        }
        return true;
    }
}
