package com.eventpool;

/**
 * Exception thrown when an error occurs in the event pool.
 */
public class EventPoolException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventPoolException(String message) {
        super(message);
    }
}
