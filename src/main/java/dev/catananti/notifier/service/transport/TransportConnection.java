package dev.catananti.notifier.service.transport;

import dev.catananti.notifier.entity.ConnectionState;

/**
 * Push channel for one tenant's notification events. Never retries on its own; reconnect policy
 * belongs to the caller.
 */
public interface TransportConnection {

    /**
     * Open the channel for {@code tenantId}. A no-op when already connecting or connected for the same
     * tenant; a different tenant tears the previous connection down first.
     */
    void connect(String tenantId, TransportListener listener);

    /**
     * Close the channel. Calling it again, or when nothing is open, does nothing.
     */
    void disconnect(String reason);

    /**
     * True only when the state is {@link ConnectionState#CONNECTED} and the socket is still open.
     */
    boolean isConnected();

    ConnectionState getState();

    String getTenantId();
}
