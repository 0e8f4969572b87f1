package dev.catananti.notifier.service.transport;

import dev.catananti.notifier.dto.NotificationEnvelope;

/**
 * Callbacks from a {@link TransportConnection}. Implementations are never invoked while the
 * transport holds its own lock, so they may call back into the transport.
 */
public interface TransportListener {

    void onConnected();

    /**
     * A recognised application envelope arrived.
     */
    void onMessage(NotificationEnvelope envelope);

    /**
     * Network failure, handshake timeout, heartbeat loss or protocol error.
     * Always followed by {@link #onDisconnected(String)}.
     */
    void onError(Throwable error);

    void onDisconnected(String reason);
}
