package dev.catananti.notifier.exception;

/**
 * Protocol level failure on the push transport: rejected subscription, server disconnect,
 * unexpected close or lost heartbeat.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
