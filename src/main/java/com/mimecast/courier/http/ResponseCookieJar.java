package com.mimecast.courier.http;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * In-memory cookie jar.
 *
 * <p>Cookies are keyed by name, domain and path so a newer cookie replaces an older one.
 * <br>Expired cookies are dropped on save and never loaded.
 * <br>Domain, path and secure matching follow {@link Cookie#matches(HttpUrl)}.
 */
public class ResponseCookieJar implements CookieJar {
    private final List<Cookie> cookies = new ArrayList<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> received) {
        long now = System.currentTimeMillis();
        for (Cookie cookie : received) {
            cookies.removeIf(existing -> existing.name().equals(cookie.name())
                    && existing.domain().equals(cookie.domain())
                    && existing.path().equals(cookie.path()));
            if (cookie.expiresAt() > now) {
                cookies.add(cookie);
            }
        }
    }

    @Override
    public synchronized List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        for (Iterator<Cookie> it = cookies.iterator(); it.hasNext(); ) {
            Cookie cookie = it.next();
            if (cookie.expiresAt() <= now) {
                it.remove();
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }
}
