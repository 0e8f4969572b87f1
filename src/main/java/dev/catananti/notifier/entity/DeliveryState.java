package dev.catananti.notifier.entity;

/**
 * Delivery session states.
 * <ul>
 *   <li>{@code IDLE} - no session, nothing running</li>
 *   <li>{@code CONNECTING} - first transport attempt in flight</li>
 *   <li>{@code LIVE} - events arrive over the transport, polling stopped</li>
 *   <li>{@code POLLING} - transport unavailable, fallback loop running</li>
 * </ul>
 */
public enum DeliveryState {
    IDLE,
    CONNECTING,
    LIVE,
    POLLING
}
