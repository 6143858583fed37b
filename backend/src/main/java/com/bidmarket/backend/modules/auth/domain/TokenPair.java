package com.bidmarket.backend.modules.auth.domain;

/**
 * Refresh token halves. The selector is a public lookup key; only a hash of the verifier is stored.
 */
public record TokenPair(String selector, String verifier) {

    public static final char SEPARATOR = '.';

    public String fullToken() {
        return selector + SEPARATOR + verifier;
    }

    @Override
    public String toString() {
        return "TokenPair[selector=" + selector + ", verifier=<redacted>]";
    }
}
