package com.example.techpack.domain.exception;

/**
 * Raised when a caller asks to analyze a {@code null} {@link java.nio.file.Path}.
 */
public class TechPackPathRequiredException extends DomainException {

    public TechPackPathRequiredException() {
        super("Tech pack path is required.");
    }
}
