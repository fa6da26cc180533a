package com.mimecast.courier.http;

/**
 * Outcome of a single transport execution.
 *
 * <p>Either a success or a failure with a kind and a human readable message.
 */
public class TransportResult {
    private static final TransportResult SUCCESS = new TransportResult(true, null, null);

    private final boolean success;
    private final ErrorKind errorKind;
    private final String message;

    private TransportResult(boolean success, ErrorKind errorKind, String message) {
        this.success = success;
        this.errorKind = errorKind;
        this.message = message;
    }

    /**
     * Gets the success result.
     *
     * @return TransportResult instance.
     */
    public static TransportResult success() {
        return SUCCESS;
    }

    /**
     * Constructs a failure result.
     *
     * @param errorKind Failure kind.
     * @param message   Error message.
     * @return TransportResult instance.
     */
    public static TransportResult failure(ErrorKind errorKind, String message) {
        return new TransportResult(false, errorKind, message);
    }

    /**
     * Is success.
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Gets failure kind.
     *
     * @return ErrorKind or null on success.
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * Gets failure message.
     *
     * @return Message string or null on success.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return success ? "SUCCESS" : errorKind + ": " + message;
    }
}
