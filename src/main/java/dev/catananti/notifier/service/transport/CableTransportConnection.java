package dev.catananti.notifier.service.transport;

import dev.catananti.notifier.config.NotifierConfig;
import dev.catananti.notifier.entity.ConnectionState;
import dev.catananti.notifier.entity.EventType;
import dev.catananti.notifier.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TransportConnection} over an ActionCable WebSocket.
 * <p>
 * Each {@link #connect} creates a {@link CableSession}. A session is closed exactly once, either by
 * {@link #disconnect}, by a tenant switch or by a failure, and only the first of those reaches the
 * listener. State changes happen under {@code lock}; listener callbacks run after it is released.
 * </p>
 */
@Component
@Slf4j
public class CableTransportConnection implements TransportConnection {

    private final WebSocketClient webSocketClient;
    private final CableFrameCodec codec;
    private final Scheduler scheduler;
    private final String cableUrl;
    private final String token;
    private final Duration connectTimeout;
    private final Duration heartbeatTimeout;

    private final Object lock = new Object();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private CableSession current;

    public CableTransportConnection(WebSocketClient webSocketClient,
                                    CableFrameCodec codec,
                                    NotifierConfig config,
                                    @Qualifier("notifierScheduler") Scheduler scheduler) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.scheduler = scheduler;
        this.cableUrl = config.getCableUrl();
        this.token = config.hasApiToken() ? config.getApiToken() : null;
        this.connectTimeout = config.getConnectTimeout();
        this.heartbeatTimeout = config.getHeartbeatTimeout();
    }

    @Override
    public void connect(String tenantId, TransportListener listener) {
        Objects.requireNonNull(listener, "listener");
        CableSession previous;
        CableSession next;
        synchronized (lock) {
            if (current != null && !current.isClosed() && Objects.equals(current.tenantId, tenantId)) {
                log.debug("Cable already {} for tenant {}, ignoring connect", state, tenantId);
                return;
            }
            previous = current != null && current.markClosed() ? current : null;
            next = new CableSession(tenantId, listener);
            current = next;
            state = ConnectionState.CONNECTING;
        }
        if (previous != null) {
            log.info("Switching cable from tenant {} to {}", previous.tenantId, tenantId);
            previous.release();
            notifyListener(previous, () -> previous.listener.onDisconnected("tenant changed"));
        }
        open(next);
    }

    @Override
    public void disconnect(String reason) {
        CableSession session;
        synchronized (lock) {
            session = current;
            if (session == null || !session.markClosed()) {
                return;
            }
            state = ConnectionState.DISCONNECTED;
            current = null;
        }
        log.info("Cable disconnected for tenant {}: {}", session.tenantId, reason);
        session.release();
        notifyListener(session, () -> session.listener.onDisconnected(reason));
    }

    @Override
    public boolean isConnected() {
        synchronized (lock) {
            return state == ConnectionState.CONNECTED
                    && current != null
                    && current.socket != null
                    && current.socket.isOpen();
        }
    }

    @Override
    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public String getTenantId() {
        synchronized (lock) {
            return current == null ? null : current.tenantId;
        }
    }

    // ==================== Session lifecycle ====================

    private void open(CableSession session) {
        URI uri = buildUri(session.tenantId);
        log.info("Opening cable for tenant {} at {}", session.tenantId, cableUrl);
        session.timers.update(scheduler.schedule(
                () -> fail(session, new TimeoutException("Cable handshake timed out after " + connectTimeout.toSeconds() + "s")),
                connectTimeout.toMillis(), TimeUnit.MILLISECONDS));
        session.connection = webSocketClient.execute(uri, socket -> handle(session, socket))
                .subscribe(
                        null,
                        error -> fail(session, error),
                        () -> fail(session, new TransportException("Cable closed by server")));
        if (session.isClosed()) {
            // closed while subscribing; make sure the socket does not outlive the session
            session.release();
        }
    }

    private Mono<Void> handle(CableSession session, WebSocketSession socket) {
        session.socket = socket;
        if (!markConnected(session)) {
            return socket.close();
        }
        for (String channel : CableFrameCodec.CHANNELS) {
            session.send(codec.subscribe(channel, session.tenantId));
        }
        notifyListener(session, session.listener::onConnected);

        Mono<Void> outbound = socket.send(session.outbound.asFlux().map(socket::textMessage));
        Mono<Void> inbound = socket.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> onFrame(session, text))
                .then();
        return Mono.zip(inbound, outbound).then();
    }

    private boolean markConnected(CableSession session) {
        synchronized (lock) {
            if (current != session || session.isClosed()) {
                return false;
            }
            state = ConnectionState.CONNECTED;
        }
        log.info("Cable connected for tenant {}", session.tenantId);
        armWatchdog(session);
        return true;
    }

    private void onFrame(CableSession session, String text) {
        if (session.isClosed()) {
            return;
        }
        armWatchdog(session);
        CableFrameCodec.CableFrame frame = codec.decode(text);
        switch (frame.kind()) {
            case WELCOME -> log.debug("Cable welcome received");
            case PING -> session.send(codec.pong());
            case CONFIRM_SUBSCRIPTION -> log.info("Cable subscription confirmed: {}", frame.detail());
            case REJECT_SUBSCRIPTION ->
                    fail(session, new TransportException("Cable subscription rejected: " + frame.detail()));
            case DISCONNECT ->
                    fail(session, new TransportException("Cable server requested disconnect: " + frame.detail()));
            case MALFORMED -> log.warn("Dropping unparseable cable frame: {}", frame.detail());
            case MESSAGE -> {
                String type = frame.envelope().type();
                if (EventType.fromValue(type).isEmpty()) {
                    log.debug("Dropping cable message with unknown type '{}'", type);
                } else {
                    notifyListener(session, () -> session.listener.onMessage(frame.envelope()));
                }
            }
            default -> log.debug("Ignoring cable frame without a known type: {}", frame.detail());
        }
    }

    private void armWatchdog(CableSession session) {
        session.timers.update(scheduler.schedule(
                () -> fail(session, new TimeoutException(
                        "No cable traffic for " + heartbeatTimeout.toSeconds() + "s")),
                heartbeatTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void fail(CableSession session, Throwable error) {
        if (!session.markClosed()) {
            return;
        }
        synchronized (lock) {
            if (current == session) {
                state = ConnectionState.DISCONNECTED;
                current = null;
            }
        }
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.warn("Cable connection for tenant {} failed: {}", session.tenantId, reason);
        session.release();
        notifyListener(session, () -> session.listener.onError(error));
        notifyListener(session, () -> session.listener.onDisconnected(reason));
    }

    private void notifyListener(CableSession session, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Transport listener for tenant {} threw: {}", session.tenantId, e.getMessage(), e);
        }
    }

    private URI buildUri(String tenantId) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(cableUrl);
        if (token != null) {
            builder.queryParam("token", token);
        }
        return builder.queryParam("restaurant_id", tenantId)
                .encode()
                .build()
                .toUri();
    }

    /**
     * One connection attempt and, if it succeeds, its socket.
     */
    private static final class CableSession {

        private final String tenantId;
        private final TransportListener listener;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Disposable.Swap timers = Disposables.swap();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile Disposable connection;
        private volatile WebSocketSession socket;

        private CableSession(String tenantId, TransportListener listener) {
            this.tenantId = tenantId;
            this.listener = listener;
        }

        boolean isClosed() {
            return closed.get();
        }

        /**
         * @return true for the caller that actually closed the session
         */
        boolean markClosed() {
            return closed.compareAndSet(false, true);
        }

        void send(String frame) {
            Sinks.EmitResult result = outbound.tryEmitNext(frame);
            if (result.isFailure()) {
                log.debug("Cable frame not sent ({}): {}", result, frame);
            }
        }

        void release() {
            timers.dispose();
            outbound.tryEmitComplete();
            Disposable active = connection;
            if (active != null) {
                active.dispose();
            }
        }
    }
}
