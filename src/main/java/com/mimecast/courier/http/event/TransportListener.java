package com.mimecast.courier.http.event;

/**
 * Transport lifecycle listener.
 *
 * <p>Per execution the notifications arrive in this order:
 * <ol>
 *   <li>{@link #onRequest} once the request is built.</li>
 *   <li>{@link #onResponse} with the response log or failure message.</li>
 *   <li>Exactly one of {@link #onSuccess} or {@link #onFail}.</li>
 * </ol>
 * <p>{@link #onRequest} is skipped when the request cannot be built.
 * <p>All methods default to no-op so implementations pick the ones they need.
 */
public interface TransportListener {

    /**
     * Called when the request is built.
     *
     * @param event Request event.
     */
    default void onRequest(TransportRequestEvent event) {
        // No-op.
    }

    /**
     * Called when the execution completes.
     *
     * @param event Response event.
     */
    default void onResponse(TransportResponseEvent event) {
        // No-op.
    }

    /**
     * Called when the execution succeeds.
     *
     * @param event Event.
     */
    default void onSuccess(TransportEvent event) {
        // No-op.
    }

    /**
     * Called when the execution fails.
     *
     * @param event Fail event.
     */
    default void onFail(TransportFailEvent event) {
        // No-op.
    }
}
