package com.project.image.bgremoval.exceptions;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({StorageException.class, BackgroundRemovalException.class})
    public String handleDomainExceptions(RuntimeException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "index";
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        model.addAttribute("error", "The file is too large. Maximum size: 5MB");
        return "remove";
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        model.addAttribute("error", "Invalid settings: sensitivity must be 1-100 and edge smoothness 0-10.");
        return "remove";
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        model.addAttribute("error", "The file could not be processed. Please try another image.");
        return "remove";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        model.addAttribute("error", "Invalid input: " + ex.getMessage());
        return "remove";
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "An unexpected error occurred. Please try again.");
        return "index";
    }
}
