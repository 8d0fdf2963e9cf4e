package com.pocketdb.tunnel;

/**
 * Thrown when tunnel credentials carry no password. Only password authentication is supported.
 */
public class AuthUnsupportedException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public AuthUnsupportedException(String message) {
        super(message);
    }
}
