package com.project.image.bgremoval.exceptions;

/** Thrown from inside the pipeline once its cancellation token has been cancelled. */
public class RemovalCancelledException extends BackgroundRemovalException {
    public RemovalCancelledException(String message) { super(message); }
}
