package com.mimecast.courier.http;

/**
 * Exception thrown while building, sending or processing a transport call.
 *
 * <p>Never escapes {@link HttpTransport#send(Object)} which turns it into a {@link TransportResult}.
 */
public class TransportException extends Exception {
    private final ErrorKind kind;

    /**
     * Constructs a new TransportException.
     *
     * @param kind    Failure kind.
     * @param message Error message.
     */
    public TransportException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new TransportException with cause.
     *
     * @param kind    Failure kind.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public TransportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets failure kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
