package com.mimecast.courier.http.client;

import com.mimecast.courier.config.TransportConfig;
import com.mimecast.courier.http.TransportException;
import okhttp3.OkHttpClient;

/**
 * Provides the HTTP client for one transport execution.
 *
 * @see FactoryClientProvider
 * @see AdHocClientProvider
 */
public interface ClientProvider {

    /**
     * Gets client for the given transport configuration.
     *
     * @param config Transport configuration.
     * @return OkHttpClient instance.
     * @throws TransportException When the client cannot be built.
     */
    OkHttpClient getClient(TransportConfig config) throws TransportException;

    /**
     * Releases client after the execution.
     * <p>Shared clients are left untouched.
     *
     * @param client OkHttpClient instance.
     */
    default void release(OkHttpClient client) {
        // Shared by default.
    }
}
