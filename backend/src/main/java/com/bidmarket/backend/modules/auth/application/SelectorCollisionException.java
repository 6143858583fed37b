package com.bidmarket.backend.modules.auth.application;

/**
 * A freshly generated selector is already taken. Callers generate a new pair and try again.
 */
public class SelectorCollisionException extends RuntimeException {

    public SelectorCollisionException(String selector) {
        super("token selector already in use: " + selector);
    }
}
