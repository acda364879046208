package com.example.scvl.exception;

/**
 * The generated slug is already taken. Callers generate a new one and retry.
 */
public class SlugConflictException extends StoreException {
    public SlugConflictException(String slug, Throwable cause) {
        super("Slug already exists: " + slug, cause);
    }
}
