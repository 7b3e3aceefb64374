package com.project.image.bgremoval.core;

/**
 * Receives progress percentages (0 to 100) from the pipeline. Masking reports 0..50 and
 * compositing 50..100. Called synchronously on the processing thread; implementations should
 * return quickly and must not throw.
 */
@FunctionalInterface
public interface ProgressSink {
    ProgressSink NONE = percent -> { };

    void report(double percent);
}
