package com.mimecast.courier.http;

/**
 * Transport failure kinds.
 */
public enum ErrorKind {

    /**
     * Request could not be built from configuration, e.g. missing URI.
     */
    CONFIGURATION,

    /**
     * Request body of a type that cannot be encoded.
     */
    UNSUPPORTED_BODY,

    /**
     * Response received with a non-success status.
     */
    HTTP_STATUS,

    /**
     * Connection, TLS, timeout or other I/O failure.
     */
    TRANSPORT,

    /**
     * Response refused by response processing.
     */
    REJECTED
}
