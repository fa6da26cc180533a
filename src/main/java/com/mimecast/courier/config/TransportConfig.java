package com.mimecast.courier.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport configuration container.
 *
 * <p>This class provides type safe access to the configuration of a single HTTP transport.
 * <p>It can be loaded from a JSON5 file or assembled programmatically with the fluent setters.
 *
 * <p>Headers are kept as an ordered list of name/value pairs.
 * <br>They may be given as a JSON object or as a list of <i>{name, value}</i> objects where the latter allows repeats.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   method: "POST",
 *   baseAddress: "https://api.example.com/",
 *   uri: "v1/orders",
 *   headers: [
 *     {name: "Accept", value: "application/json"},
 *     {name: "Content-Type", value: "application/xml"}
 *   ],
 *   clientName: "orders"
 * }
 * </pre>
 *
 * @see ConfigFoundation
 */
@SuppressWarnings("unchecked")
public class TransportConfig extends ConfigFoundation {

    /**
     * Default client profile name.
     */
    public static final String DEFAULT_CLIENT = "default";

    /**
     * Constructs a new TransportConfig instance.
     */
    public TransportConfig() {
        super(new LinkedHashMap<>());
    }

    /**
     * Constructs a new TransportConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public TransportConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new TransportConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public TransportConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets HTTP method upper cased.
     *
     * @return Method string.
     */
    public String getMethod() {
        return getStringProperty("method", "GET").trim().toUpperCase();
    }

    /**
     * Sets HTTP method.
     *
     * @param method Method string.
     * @return Self.
     */
    public TransportConfig setMethod(String method) {
        map.put("method", method);
        return this;
    }

    /**
     * Gets base address.
     *
     * @return Base address string or empty.
     */
    public String getBaseAddress() {
        return getStringProperty("baseAddress", "");
    }

    /**
     * Sets base address.
     *
     * @param baseAddress Base address string.
     * @return Self.
     */
    public TransportConfig setBaseAddress(String baseAddress) {
        map.put("baseAddress", baseAddress);
        return this;
    }

    /**
     * Gets request URI.
     * <p>Absolute without a base address, relative otherwise.
     *
     * @return URI string or empty.
     */
    public String getUri() {
        return getStringProperty("uri", "");
    }

    /**
     * Sets request URI.
     *
     * @param uri URI string.
     * @return Self.
     */
    public TransportConfig setUri(String uri) {
        map.put("uri", uri);
        return this;
    }

    /**
     * Gets headers as ordered pairs.
     *
     * @return List of Pair of String, String.
     */
    public List<Pair<String, String>> getHeaders() {
        List<Pair<String, String>> headers = new ArrayList<>();
        Object value = getProperty("headers");

        if (value instanceof Map) {
            ((Map<String, Object>) value).forEach((name, header) ->
                    headers.add(new ImmutablePair<>(name, header != null ? String.valueOf(header) : "")));
        } else if (value instanceof List) {
            for (Object entry : (List<Object>) value) {
                if (entry instanceof Map) {
                    BasicConfig header = new BasicConfig((Map<String, Object>) entry);
                    if (StringUtils.isNotBlank(header.getStringProperty("name"))) {
                        headers.add(new ImmutablePair<>(header.getStringProperty("name"), header.getStringProperty("value", "")));
                    }
                }
            }
        }

        return headers;
    }

    /**
     * Adds a header keeping insertion order.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public TransportConfig addHeader(String name, String value) {
        List<Object> list = new ArrayList<>();
        for (Pair<String, String> header : getHeaders()) {
            list.add(header(header.getKey(), header.getValue()));
        }
        list.add(header(name, value));
        map.put("headers", list);
        return this;
    }

    /**
     * Gets client profile name.
     *
     * @return Profile name.
     */
    public String getClientName() {
        return getStringProperty("clientName", DEFAULT_CLIENT);
    }

    /**
     * Sets client profile name.
     *
     * @param clientName Profile name.
     * @return Self.
     */
    public TransportConfig setClientName(String clientName) {
        map.put("clientName", clientName);
        return this;
    }

    /**
     * Gets transport encoding.
     * <p>Used for text request bodies and to decode textual responses.
     *
     * @return Charset, UTF-8 by default.
     */
    public Charset getEncoding() {
        String encoding = getStringProperty("encoding", "");
        return StringUtils.isBlank(encoding) ? StandardCharsets.UTF_8 : Charset.forName(encoding);
    }

    /**
     * Sets transport encoding.
     *
     * @param encoding Charset name.
     * @return Self.
     */
    public TransportConfig setEncoding(String encoding) {
        map.put("encoding", encoding);
        return this;
    }

    /**
     * Gets call timeout for ad hoc clients.
     *
     * @return Timeout in seconds, 0 when not configured.
     */
    public long getTimeout() {
        return getLongProperty("timeout", 0L);
    }

    /**
     * Sets call timeout for ad hoc clients.
     *
     * @param seconds Timeout in seconds.
     * @return Self.
     */
    public TransportConfig setTimeout(long seconds) {
        map.put("timeout", seconds);
        return this;
    }

    /**
     * Checks if a fresh client should be built for every call.
     * <p>Implied by a client certificate.
     *
     * @return Boolean.
     */
    public boolean isAdHoc() {
        return getBooleanProperty("adHoc", false) || getCertificate() != null;
    }

    /**
     * Sets ad hoc client mode.
     *
     * @param adHoc Boolean.
     * @return Self.
     */
    public TransportConfig setAdHoc(boolean adHoc) {
        map.put("adHoc", adHoc);
        return this;
    }

    /**
     * Gets client certificate configuration if any.
     *
     * @return CertificateConfig instance or null.
     */
    public CertificateConfig getCertificate() {
        CertificateConfig certificate = new CertificateConfig(getMapProperty("certificate"));
        return StringUtils.isNotBlank(certificate.getPath()) ? certificate : null;
    }

    /**
     * Sets client certificate.
     *
     * @param path     Key store path.
     * @param password Key store password.
     * @return Self.
     */
    public TransportConfig setCertificate(String path, String password) {
        Map<String, Object> certificate = new LinkedHashMap<>();
        certificate.put("path", path);
        certificate.put("password", password);
        map.put("certificate", certificate);
        return this;
    }

    /**
     * Builds a header map entry.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Map of String, Object.
     */
    private static Map<String, Object> header(String name, String value) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("name", name);
        header.put("value", value);
        return header;
    }
}
