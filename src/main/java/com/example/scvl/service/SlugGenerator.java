package com.example.scvl.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Produces random fixed-length slugs. Uniqueness is not checked here; the store's unique constraint
 * on the slug column catches collisions.
 */
@Component
public class SlugGenerator {

    // No 0/O/o, 1/l/I.
    static final String ALPHABET = "23456789abcdefghijkmnpqrstuvwxyzABCDEFGHJKLMNPQRSTUVWXYZ";

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public SlugGenerator(@Value("${app.slug.length:6}") int length) {
        if (length < 1 || length > 16) {
            throw new IllegalArgumentException("Slug length out of range: " + length);
        }
        this.length = length;
    }

    public String generate() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
