package com.mimecast.courier.http.client;

import okhttp3.OkHttpClient;

/**
 * Factory for named HTTP clients.
 *
 * <p>Implementations may pool clients per name.
 *
 * @see PooledHttpClientFactory
 */
public interface HttpClientFactory {

    /**
     * Gets client for the named profile.
     *
     * @param name Client profile name.
     * @return OkHttpClient instance.
     */
    OkHttpClient createClient(String name);
}
