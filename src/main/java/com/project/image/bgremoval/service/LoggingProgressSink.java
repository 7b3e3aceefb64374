package com.project.image.bgremoval.service;

import com.project.image.bgremoval.core.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs pipeline progress at DEBUG, once per completed 10% step. */
public class LoggingProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);
    private static final int STEP = 10;

    private final String label;
    private int lastLoggedStep = -1;

    public LoggingProgressSink(String label) {
        this.label = label;
    }

    @Override
    public void report(double percent) {
        int step = (int) (percent / STEP);
        if (step > lastLoggedStep) {
            lastLoggedStep = step;
            log.debug("{}: {}%", label, step * STEP);
        }
    }
}
