package com.mimecast.courier.http.event;

import com.mimecast.courier.http.HttpTransport;

/**
 * Raised when the execution completes, before success or fail.
 *
 * <p>Carries the rendered response log on success or the failure message otherwise.
 */
public class TransportResponseEvent extends TransportEvent {
    private final String response;

    /**
     * Constructs a new TransportResponseEvent instance.
     *
     * @param source   Transport raising the event.
     * @param response Response log or failure message.
     */
    public TransportResponseEvent(HttpTransport<?> source, String response) {
        super(source);
        this.response = response;
    }

    /**
     * Gets response log or failure message.
     *
     * @return String, may be null.
     */
    public String getResponse() {
        return response;
    }
}
