package dev.catananti.notifier.util;

import dev.catananti.notifier.exception.NotificationApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;

import java.util.concurrent.TimeoutException;

/**
 * Turns remote call failures into short messages fit for display next to the notification list.
 */
public final class ApiErrorMessages {

    private static final int MAX_DETAIL_LENGTH = 200;

    private ApiErrorMessages() {
    }

    public static String describe(Throwable error, String fallback) {
        Throwable root = unwrap(error);
        String detail = detail(root);
        return detail == null ? fallback : fallback + ": " + detail;
    }

    private static String detail(Throwable error) {
        if (error instanceof NotificationApiException api && api.hasStatus()) {
            return switch (api.getStatus()) {
                case 401 -> "session expired, please log in again";
                case 403 -> "not allowed for this account";
                case 404 -> "notification not found";
                case 429 -> "too many requests, try again shortly";
                default -> api.getStatus() >= 500
                        ? "server error (" + api.getStatus() + ")"
                        : truncate(api.getMessage());
            };
        }
        if (error instanceof TimeoutException) {
            return "request timed out";
        }
        if (error instanceof CallNotPermittedException) {
            return "service temporarily unavailable";
        }
        return truncate(error.getMessage());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof NotificationApiException api && !api.hasStatus() && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String truncate(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        return message.length() > MAX_DETAIL_LENGTH ? message.substring(0, MAX_DETAIL_LENGTH) + "..." : message;
    }
}
