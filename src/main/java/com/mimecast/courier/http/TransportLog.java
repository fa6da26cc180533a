package com.mimecast.courier.http;

import okhttp3.Headers;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.codec.binary.Base64;

import java.io.InputStream;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Human readable request and response logs.
 *
 * <p>Request log:
 * <pre>
 * POST https://api.example.com/v1/orders
 * Accept: application/json
 *
 * {"id": 1}
 * </pre>
 *
 * <p>Response log:
 * <pre>
 * HTTPS 1.1 200 OK
 * Content-Type: application/json
 *
 * {"status": "accepted"}
 * </pre>
 *
 * <p>Raw bodies are rendered in base64.
 */
public class TransportLog {

    /**
     * Line separator.
     */
    public static final String CRLF = "\r\n";

    /**
     * Placeholder for streamed bodies which cannot be replayed.
     */
    public static final String STREAM_BODY = "[stream]";

    /**
     * Protected constructor.
     */
    private TransportLog() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Renders request log.
     *
     * @param request Request instance.
     * @param body    Request body as given by the caller, may be null.
     * @return Log string.
     */
    public static String request(Request request, Object body) {
        StringBuilder log = new StringBuilder();
        log.append(request.method()).append(" ").append(request.url()).append(CRLF);

        Headers headers = request.headers();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < headers.size(); i++) {
            String name = headers.name(i);
            if (seen.add(name.toLowerCase())) {
                log.append(name).append(": ").append(String.join(", ", headers.values(name))).append(CRLF);
            }
        }

        log.append(CRLF);

        if (body != null) {
            if (body instanceof byte[]) {
                log.append(Base64.encodeBase64String((byte[]) body));
            } else if (body instanceof InputStream) {
                log.append(STREAM_BODY);
            } else {
                log.append(body);
            }
            log.append(CRLF);
        }

        return log.toString();
    }

    /**
     * Renders response log.
     *
     * @param response Response instance.
     * @param headers  Captured headers, may be null.
     * @param body     Captured body.
     * @return Log string or null if there is no response.
     */
    public static String response(Response response, Map<String, String> headers, ResponseBody body) {
        if (response == null) {
            return null;
        }

        StringBuilder log = new StringBuilder();
        log.append(statusLine(response)).append(CRLF);

        if (headers != null) {
            headers.forEach((name, value) -> log.append(name).append(": ").append(value).append(CRLF));
        }

        if (body != null && body.isAssigned()) {
            log.append(CRLF);
            log.append(body.isRaw() ? Base64.encodeBase64String(body.getRawValue()) : body.getValue());
            log.append(CRLF);
        }

        return log.toString();
    }

    /**
     * Renders status line.
     * <p>Example: <i>HTTP 1.1 500 InternalServerError</i>
     *
     * @param response Response instance.
     * @return Status line string.
     */
    public static String statusLine(Response response) {
        return response.request().url().scheme().toUpperCase() + " " +
                version(response.protocol()) + " " +
                response.code() + " " +
                StatusNames.get(response.code());
    }

    /**
     * Renders protocol version.
     *
     * @param protocol Protocol instance.
     * @return Version string.
     */
    static String version(Protocol protocol) {
        switch (protocol) {
            case HTTP_1_0:
                return "1.0";
            case HTTP_2:
            case H2_PRIOR_KNOWLEDGE:
                return "2.0";
            case QUIC:
                return "3.0";
            default:
                return "1.1";
        }
    }
}
