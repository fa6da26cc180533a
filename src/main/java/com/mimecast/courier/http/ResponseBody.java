package com.mimecast.courier.http;

import java.util.Arrays;
import java.util.Objects;

/**
 * Captured response body.
 *
 * <p>Holds either a textual value or raw bytes.
 * <ul>
 *   <li><b>value</b>: decoded text, null when raw.</li>
 *   <li><b>rawValue</b>: bytes, null when textual.</li>
 *   <li><b>raw</b>: true when the bytes branch is populated.</li>
 *   <li><b>assigned</b>: false until a body has been captured.</li>
 * </ul>
 */
public final class ResponseBody {

    /**
     * Unassigned body.
     */
    public static final ResponseBody EMPTY = new ResponseBody(null, null, false, false);

    private final String value;
    private final byte[] rawValue;
    private final boolean raw;
    private final boolean assigned;

    private ResponseBody(String value, byte[] rawValue, boolean raw, boolean assigned) {
        this.value = value;
        this.rawValue = rawValue;
        this.raw = raw;
        this.assigned = assigned;
    }

    /**
     * Constructs a textual body.
     *
     * @param value Text.
     * @return ResponseBody instance.
     */
    public static ResponseBody text(String value) {
        return new ResponseBody(value, null, false, true);
    }

    /**
     * Constructs a raw body.
     *
     * @param rawValue Bytes.
     * @return ResponseBody instance.
     */
    public static ResponseBody raw(byte[] rawValue) {
        return new ResponseBody(null, rawValue != null ? rawValue.clone() : null, true, true);
    }

    public String getValue() {
        return value;
    }

    /**
     * Gets raw bytes.
     *
     * @return Copy of the bytes or null for textual bodies.
     */
    public byte[] getRawValue() {
        return rawValue != null ? rawValue.clone() : null;
    }

    public boolean isRaw() {
        return raw;
    }

    public boolean isAssigned() {
        return assigned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseBody)) return false;
        ResponseBody that = (ResponseBody) o;
        return raw == that.raw && assigned == that.assigned
                && Objects.equals(value, that.value) && Arrays.equals(rawValue, that.rawValue);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(value, raw, assigned) + Arrays.hashCode(rawValue);
    }

    @Override
    public String toString() {
        return "(" + value + ", " + (rawValue != null ? rawValue.length + " bytes" : null) + ", " + raw + ", " + assigned + ")";
    }
}
