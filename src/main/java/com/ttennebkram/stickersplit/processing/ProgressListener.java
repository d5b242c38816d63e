package com.ttennebkram.stickersplit.processing;

/**
 * Receives checkpoint notifications. Called from worker threads, so implementations
 * must be thread-safe when used with {@link BatchSplitter}.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
