package com.example.techpack.infrastructure.exception;

/**
 * Signals that the raw bytes of a tech pack could not be read from the upload or the disk.
 * Unreadable PDF content is not an error: the extractor then yields no lines.
 */
public class DocumentReadException extends InfrastructureException {

	/**
	 * @param message description shared with the interfaces layer
	 * @param cause   underlying I/O failure
	 */
    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
