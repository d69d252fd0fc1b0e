package de.anton.libs.analyser.libs_analyzer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Flat arena of {@link FitResult}s with one pre-allocated slot per (element, sample).
 * Each fit unit writes only its own slot, so concurrent writers need no further locking.
 */
public final class FitResults {

    private final List<String> elements;
    private final int sampleCount;
    private final AtomicReferenceArray<FitResult> slots;

    public FitResults(List<String> elements, int sampleCount) {
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("At least one element is required for the result arena.");
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("Sample count must be positive. Got: " + sampleCount);
        }
        this.elements = List.copyOf(elements);
        this.sampleCount = sampleCount;
        this.slots = new AtomicReferenceArray<>(elements.size() * sampleCount);
    }

    private int slot(int elementIndex, int sampleIndex) {
        if (elementIndex < 0 || elementIndex >= elements.size() || sampleIndex < 0 || sampleIndex >= sampleCount) {
            throw new IndexOutOfBoundsException(String.format("Slot (%d, %d) outside arena %d x %d.",
                    elementIndex, sampleIndex, elements.size(), sampleCount));
        }
        return elementIndex * sampleCount + sampleIndex;
    }

    /** Stores the result of one unit. A slot is written exactly once. */
    public void set(int elementIndex, int sampleIndex, FitResult result) {
        if (!slots.compareAndSet(slot(elementIndex, sampleIndex), null, result)) {
            throw new IllegalStateException(String.format("Slot (%d, %d) already holds a result.", elementIndex, sampleIndex));
        }
    }

    public FitResult get(int elementIndex, int sampleIndex) {
        return slots.get(slot(elementIndex, sampleIndex));
    }

    public FitResult get(String element, int sampleIndex) {
        return get(indexOf(element), sampleIndex);
    }

    /** @throws IllegalArgumentException If the element was not part of the fit. */
    public int indexOf(String element) {
        int index = elements.indexOf(element);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown element '" + element + "'. Fitted elements: " + elements);
        }
        return index;
    }

    public boolean contains(String element) { return elements.contains(element); }
    public List<String> getElements() { return elements; }
    public int getElementCount() { return elements.size(); }
    public int getSampleCount() { return sampleCount; }

    /** Number of peaks of an element, taken from its first stored result. */
    public int getPeakCount(String element) {
        FitResult first = get(element, 0);
        return first == null ? 0 : first.getPeakCount();
    }

    /** True once every slot holds a result. */
    public boolean isComplete() {
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) == null) return false;
        }
        return true;
    }

    /** All results of one element in sample order. */
    public List<FitResult> forElement(String element) {
        int e = indexOf(element);
        List<FitResult> results = new ArrayList<>(sampleCount);
        for (int s = 0; s < sampleCount; s++) {
            results.add(get(e, s));
        }
        return results;
    }

    /**
     * Per-sample values of one fitted quantity for an element.
     *
     * @return {@code double[sample][peak]}; missing results yield NaN rows.
     */
    public double[][] values(String element, FitParameter parameter) {
        int e = indexOf(element);
        int peaks = getPeakCount(element);
        double[][] values = new double[sampleCount][];
        for (int s = 0; s < sampleCount; s++) {
            FitResult result = get(e, s);
            if (result == null) {
                values[s] = new double[peaks];
                Arrays.fill(values[s], Double.NaN);
            } else {
                values[s] = parameter.valuesOf(result);
            }
        }
        return values;
    }

    public Map<FitStatus, Integer> statusCounts() {
        Map<FitStatus, Integer> counts = new EnumMap<>(FitStatus.class);
        for (FitStatus status : FitStatus.values()) {
            counts.put(status, 0);
        }
        for (int i = 0; i < slots.length(); i++) {
            FitResult result = slots.get(i);
            if (result != null) {
                counts.merge(result.getStatus(), 1, Integer::sum);
            }
        }
        return counts;
    }

    @Override
    public String toString() {
        return "FitResults{elements=" + elements + ", samples=" + sampleCount + ", status=" + statusCounts() + '}';
    }
}
