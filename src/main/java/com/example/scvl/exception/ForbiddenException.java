package com.example.scvl.exception;

/**
 * Thrown when a user tries to mutate a page owned by someone else.
 */
public class ForbiddenException extends RuntimeException {
    public ForbiddenException(String message) {
        super(message);
    }
}
