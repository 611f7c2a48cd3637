package com.notibag.sender;

/**
 * Thrown when the hub rejects a notification or cannot be reached.
 */
public class SendFailedException extends Exception {

    public SendFailedException(String message) {
        super(message);
    }

    public SendFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
