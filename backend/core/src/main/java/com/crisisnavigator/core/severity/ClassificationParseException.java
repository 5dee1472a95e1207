package com.crisisnavigator.core.severity;

public class ClassificationParseException extends RuntimeException {
    public ClassificationParseException(String message) {
        super(message);
    }

    public ClassificationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
