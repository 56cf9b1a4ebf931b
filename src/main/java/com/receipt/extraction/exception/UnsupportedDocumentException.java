package com.receipt.extraction.exception;

public class UnsupportedDocumentException extends DocumentProcessingException {

    public UnsupportedDocumentException(String message) {
        super(message);
    }
}
