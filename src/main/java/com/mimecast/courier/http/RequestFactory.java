package com.mimecast.courier.http;

import com.mimecast.courier.config.TransportConfig;
import okhttp3.Cookie;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds OkHttp requests from transport configuration.
 *
 * <p>The <i>Content-Type</i> header is taken out of the configured headers and applied to the body instead.
 * <br>Without one the body defaults to <i>application/json</i>.
 *
 * <p>Supported body shapes:
 * <ul>
 *   <li><b>String</b>: text encoded with the transport encoding, charset appended to the content type.</li>
 *   <li><b>byte[]</b>: sent as is.</li>
 *   <li><b>InputStream</b>: streamed once.</li>
 * </ul>
 */
public class RequestFactory {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String COOKIE = "Cookie";
    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");

    /**
     * Methods OkHttp refuses to send with a body.
     */
    private static final Set<String> NO_BODY_METHODS = Set.of("GET", "HEAD");

    private final TransportConfig config;
    private final List<Pair<String, String>> headers = new ArrayList<>();
    private final String contentType;

    /**
     * Constructs a new RequestFactory instance.
     *
     * @param config Transport configuration.
     */
    public RequestFactory(TransportConfig config) {
        this.config = config;

        String type = null;
        for (Pair<String, String> header : config.getHeaders()) {
            if (CONTENT_TYPE.equalsIgnoreCase(header.getKey())) {
                if (type == null) {
                    type = header.getValue();
                }
            } else {
                headers.add(header);
            }
        }
        this.contentType = StringUtils.isNotBlank(type) ? type : DEFAULT_CONTENT_TYPE;
    }

    /**
     * Gets headers without content type.
     *
     * @return List of Pair of String, String.
     */
    public List<Pair<String, String>> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Gets body content type.
     *
     * @return Content type string.
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Resolves request URL.
     * <p>The URI is absolute without a base address and relative to it otherwise.
     * <br>A base address alone targets the base address itself.
     *
     * @return HttpUrl instance.
     * @throws TransportException When neither is set or either is malformed.
     */
    public HttpUrl resolveUrl() throws TransportException {
        String baseAddress = config.getBaseAddress();
        String uri = config.getUri();

        if (StringUtils.isBlank(baseAddress) && StringUtils.isBlank(uri)) {
            throw new TransportException(ErrorKind.CONFIGURATION, "URI is not set for the request");
        }

        if (StringUtils.isBlank(baseAddress)) {
            HttpUrl url = HttpUrl.parse(uri.trim());
            if (url == null) {
                throw new TransportException(ErrorKind.CONFIGURATION, "Invalid absolute URI: " + uri);
            }
            return url;
        }

        HttpUrl base = HttpUrl.parse(baseAddress.trim());
        if (base == null) {
            throw new TransportException(ErrorKind.CONFIGURATION, "Invalid base address: " + baseAddress);
        }
        if (StringUtils.isBlank(uri)) {
            return base;
        }

        HttpUrl url = base.resolve(uri.trim());
        if (url == null) {
            throw new TransportException(ErrorKind.CONFIGURATION, "Invalid relative URI: " + uri);
        }
        return url;
    }

    /**
     * Resolves the transport encoding.
     *
     * @return Charset instance.
     * @throws TransportException When the encoding is not a known charset.
     */
    public Charset getEncoding() throws TransportException {
        try {
            return config.getEncoding();
        } catch (IllegalArgumentException e) {
            throw new TransportException(ErrorKind.CONFIGURATION,
                    "Unsupported encoding: " + config.getStringProperty("encoding"));
        }
    }

    /**
     * Builds request.
     *
     * @param body    Request body, may be null.
     * @param cookies Request cookies, may be null.
     * @return Request instance.
     * @throws TransportException When the configuration or body cannot be used.
     */
    public Request create(Object body, List<Cookie> cookies) throws TransportException {
        Request.Builder builder = new Request.Builder().url(resolveUrl());
        getEncoding();

        try {
            if (cookies != null && !cookies.isEmpty()) {
                builder.addHeader(COOKIE, cookies.stream()
                        .map(cookie -> cookie.name() + "=" + cookie.value())
                        .collect(Collectors.joining("; ")));
            }

            for (Pair<String, String> header : headers) {
                builder.addHeader(header.getKey(), header.getValue());
            }

            String method = config.getMethod();
            RequestBody content = createContent(body);
            if (content == null && BODY_METHODS.contains(method)) {
                content = RequestBody.create(new byte[0], null);
            }
            if (content != null && NO_BODY_METHODS.contains(method)) {
                throw new TransportException(ErrorKind.UNSUPPORTED_BODY, "Method " + method + " does not permit a request body");
            }

            return builder.method(method, content).build();
        } catch (IllegalArgumentException e) {
            throw new TransportException(ErrorKind.CONFIGURATION, "Invalid request: " + e.getMessage());
        }
    }

    /**
     * Encodes body by runtime type.
     *
     * @param body Request body, may be null.
     * @return RequestBody instance or null when there is no body.
     * @throws TransportException When the body type is not supported or the content type is malformed.
     */
    public RequestBody createContent(Object body) throws TransportException {
        if (body == null) {
            return null;
        }

        if (body instanceof String) {
            Charset charset = getEncoding();
            MediaType mediaType = mediaType(contentType);
            if (mediaType.charset() == null) {
                mediaType = mediaType(contentType + "; charset=" + charset.name().toLowerCase());
            }
            return RequestBody.create(((String) body).getBytes(charset), mediaType);
        }

        if (body instanceof byte[]) {
            return RequestBody.create((byte[]) body, mediaType(contentType));
        }

        if (body instanceof InputStream) {
            return new StreamRequestBody((InputStream) body, mediaType(contentType));
        }

        throw new TransportException(ErrorKind.UNSUPPORTED_BODY,
                "Body of type " + body.getClass().getSimpleName() + " is not supported");
    }

    /**
     * Parses media type.
     *
     * @param value Content type string.
     * @return MediaType instance.
     * @throws TransportException When the content type is malformed.
     */
    private static MediaType mediaType(String value) throws TransportException {
        MediaType mediaType = MediaType.parse(value);
        if (mediaType == null) {
            throw new TransportException(ErrorKind.CONFIGURATION, "Invalid content type: " + value);
        }
        return mediaType;
    }
}
