package de.anton.libs.analyser.libs_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts completed units and forwards them to a {@link ProgressListener}.
 * A failing listener is logged and otherwise ignored, it never affects the computation.
 */
public final class ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressListener listener;
    private final int total;
    private final AtomicInteger completed = new AtomicInteger();

    public ProgressReporter(ProgressListener listener, int total) {
        this.listener = listener == null ? ProgressListener.NONE : listener;
        this.total = total;
    }

    /** Marks one unit as done and notifies the listener. */
    public void unitDone() {
        int done = completed.incrementAndGet();
        try {
            listener.onProgress(done, total);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed at unit {}/{}: {}", done, total, e.getMessage(), e);
        }
    }

    public int getCompleted() { return completed.get(); }
    public int getTotal() { return total; }
}
