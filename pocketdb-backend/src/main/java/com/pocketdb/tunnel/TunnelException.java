package com.pocketdb.tunnel;

/**
 * Thrown when the SSH transport cannot be established or authenticated.
 */
public class TunnelException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying transport error
     */
    public TunnelException(String message, Throwable cause) {
        super(message, cause);
    }
}
