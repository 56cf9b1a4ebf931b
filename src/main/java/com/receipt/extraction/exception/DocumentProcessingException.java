package com.receipt.extraction.exception;

/**
 * The input could not be turned into an image, so no extraction is possible.
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
