package dev.catananti.notifier.exception;

/**
 * Raised when a call to the restaurant notification API fails.
 * Carries the HTTP status when the server answered, or 0 for transport-level failures.
 */
public class NotificationApiException extends RuntimeException {

    private final String operation;
    private final int status;

    public NotificationApiException(String operation, int status, String message) {
        super(message);
        this.operation = operation;
        this.status = status;
    }

    public NotificationApiException(String operation, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.operation = operation;
        this.status = 0;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatus() {
        return status;
    }

    public boolean hasStatus() {
        return status > 0;
    }
}
