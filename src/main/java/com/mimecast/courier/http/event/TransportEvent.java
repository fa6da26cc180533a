package com.mimecast.courier.http.event;

import com.mimecast.courier.http.HttpTransport;

/**
 * Base transport lifecycle event.
 *
 * <p>Carries the transport that raised it.
 */
public class TransportEvent {
    private final HttpTransport<?> source;

    /**
     * Constructs a new TransportEvent instance.
     *
     * @param source Transport raising the event.
     */
    public TransportEvent(HttpTransport<?> source) {
        this.source = source;
    }

    /**
     * Gets transport raising the event.
     *
     * @return HttpTransport instance.
     */
    public HttpTransport<?> getSource() {
        return source;
    }
}
