package com.project.image.bgremoval.exceptions;

/** Failure to store or resolve an uploaded or generated file. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
