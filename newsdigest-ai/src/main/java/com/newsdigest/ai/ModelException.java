package com.newsdigest.ai;

/**
 * Exception thrown by the model gateway.
 */
public class ModelException extends Exception {

    public enum ErrorType {
        CONFIGURATION,   // Missing or malformed settings, raised before any I/O
        TRANSPORT,       // Connection failure or timeout
        HTTP_STATUS,     // Provider answered with a non-2xx status
        DECODE,          // Response body is not the expected JSON
        EMPTY_RESPONSE   // Valid JSON without any reply text
    }

    private final ErrorType type;

    public ModelException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public ModelException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Check if retrying later could succeed without changing settings.
     */
    public boolean isTransient() {
        return type == ErrorType.TRANSPORT || type == ErrorType.HTTP_STATUS;
    }
}
