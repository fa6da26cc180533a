package com.mimecast.courier.http.event;

import com.mimecast.courier.http.ErrorKind;
import com.mimecast.courier.http.HttpTransport;

/**
 * Raised when the execution fails.
 */
public class TransportFailEvent extends TransportEvent {
    private final ErrorKind errorKind;
    private final String message;

    /**
     * Constructs a new TransportFailEvent instance.
     *
     * @param source    Transport raising the event.
     * @param errorKind Failure kind.
     * @param message   Failure message.
     */
    public TransportFailEvent(HttpTransport<?> source, ErrorKind errorKind, String message) {
        super(source);
        this.errorKind = errorKind;
        this.message = message;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }
}
