package de.anton.libs.analyser.libs_analyzer.model;

/**
 * Receives a notification after every completed unit of a long-running computation
 * (one region, one fit unit, one sample). Called from worker threads; implementations must not block.
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores all notifications. */
    ProgressListener NONE = (completed, total) -> { };

    /**
     * @param completed Units finished so far (1-based).
     * @param total     Units in the whole run.
     */
    void onProgress(int completed, int total);
}
