package com.mimecast.courier.http.event;

import com.mimecast.courier.http.HttpTransport;

/**
 * Raised once the request is built, before it is sent.
 */
public class TransportRequestEvent extends TransportEvent {
    private final String request;

    /**
     * Constructs a new TransportRequestEvent instance.
     *
     * @param source  Transport raising the event.
     * @param request Rendered request log.
     */
    public TransportRequestEvent(HttpTransport<?> source, String request) {
        super(source);
        this.request = request;
    }

    /**
     * Gets rendered request log.
     *
     * @return Request log string.
     */
    public String getRequest() {
        return request;
    }
}
