package com.project.image.bgremoval.exceptions;

/** Domain-specific exception for background removal and image decoding errors. */
public class BackgroundRemovalException extends RuntimeException {
    public BackgroundRemovalException(String message) { super(message); }
    public BackgroundRemovalException(String message, Throwable cause) { super(message, cause); }
}
