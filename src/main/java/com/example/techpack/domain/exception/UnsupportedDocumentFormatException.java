package com.example.techpack.domain.exception;

/**
 * Raised when the uploaded file does not resemble a PDF, the only format the text extractor reads.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only PDF tech packs are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
