package dev.catananti.notifier.entity;

/**
 * State of the single cable connection held for the current tenant.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
