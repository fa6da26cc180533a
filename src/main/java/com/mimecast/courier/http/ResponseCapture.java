package com.mimecast.courier.http;

import okhttp3.Cookie;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Captures headers, cookies and body of successful responses.
 *
 * <p>Bodies with a content type in {@link #RAW_TYPES} or without a content type are kept as raw bytes.
 * <br>All others are decoded to text with the transport encoding.
 */
public class ResponseCapture {

    public static final String SET_COOKIE = "Set-Cookie";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";

    /**
     * Media types kept as raw bytes.
     */
    public static final Set<String> RAW_TYPES = Set.of(
            "application/octet-stream",
            "application/pdf",
            "application/rtf",
            "application/zip"
    );

    /**
     * Protected constructor.
     */
    private ResponseCapture() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets response headers.
     * <p>Response headers come first followed by the content headers of the body.
     *
     * @param response Response instance.
     * @return Map of String, String.
     */
    public static Map<String, String> headers(Response response) {
        return headers(List.of(response.headers(), contentHeaders(response)));
    }

    /**
     * Merges header collections.
     * <p>Within a collection repeated names are combined with ", ".
     * <br>Across collections the first key seen wins.
     *
     * @param sources Header collections in priority order.
     * @return Insertion ordered map of String, String.
     */
    public static Map<String, String> headers(List<Headers> sources) {
        Map<String, String> result = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (Headers headers : sources) {
            Map<String, List<String>> grouped = new LinkedHashMap<>();
            Map<String, String> spelling = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                String key = headers.name(i).toLowerCase(Locale.ROOT);
                spelling.putIfAbsent(key, headers.name(i));
                grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(headers.value(i));
            }

            // HTTP/2 lowercases names so keys match regardless of case.
            grouped.forEach((key, values) -> {
                if (seen.add(key)) {
                    result.put(spelling.get(key), String.join(", ", values));
                }
            });
        }

        return result;
    }

    /**
     * Gets content headers derived from the response body.
     *
     * @param response Response instance.
     * @return Headers instance.
     */
    static Headers contentHeaders(Response response) {
        Headers.Builder builder = new Headers.Builder();
        okhttp3.ResponseBody body = response.body();
        if (body != null) {
            MediaType contentType = body.contentType();
            if (contentType != null) {
                builder.add(CONTENT_TYPE, contentType.toString());
            }
            if (body.contentLength() >= 0) {
                builder.add(CONTENT_LENGTH, String.valueOf(body.contentLength()));
            }
        }
        return builder.build();
    }

    /**
     * Gets response cookies.
     * <p>Set-Cookie values are replayed into a cookie jar scoped to the effective response URL and read back.
     *
     * @param response Response instance.
     * @return List of Cookie, empty without Set-Cookie headers.
     */
    public static List<Cookie> cookies(Response response) {
        List<String> values = response.headers(SET_COOKIE);
        if (values.isEmpty()) {
            return Collections.emptyList();
        }

        HttpUrl url = response.request().url();
        ResponseCookieJar jar = new ResponseCookieJar();
        jar.saveFromResponse(url, Cookie.parseAll(url, response.headers()));

        return jar.loadForRequest(url);
    }

    /**
     * Reads response body fully into memory.
     *
     * @param response Response instance.
     * @param charset  Text encoding.
     * @return ResponseBody instance.
     * @throws IOException Unable to read body.
     */
    public static ResponseBody body(Response response, Charset charset) throws IOException {
        okhttp3.ResponseBody body = response.body();
        if (body == null) {
            return ResponseBody.EMPTY;
        }

        byte[] bytes = body.bytes();
        if (isRaw(body.contentType())) {
            return ResponseBody.raw(bytes);
        }

        return ResponseBody.text(new String(bytes, charset));
    }

    /**
     * Checks if a content type is kept as raw bytes.
     *
     * @param contentType MediaType instance, may be null.
     * @return Boolean.
     */
    public static boolean isRaw(MediaType contentType) {
        if (contentType == null) {
            return true;
        }
        String mediaType = (contentType.type() + "/" + contentType.subtype()).toLowerCase(Locale.ROOT);
        return RAW_TYPES.contains(mediaType);
    }
}
