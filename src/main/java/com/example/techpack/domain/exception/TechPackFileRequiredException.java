package com.example.techpack.domain.exception;

/**
 * Raised when an upload arrives without a tech pack document or with an empty one.
 */
public class TechPackFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public TechPackFileRequiredException() {
        super("Please choose a tech pack PDF to upload.");
    }
}
