package com.di.geoingest.source;

/**
 * A source dataset could not be opened or its schema could not be read.
 */
public class SourceOpenException extends RuntimeException {

    public SourceOpenException(String message) {
        super(message);
    }

    public SourceOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
