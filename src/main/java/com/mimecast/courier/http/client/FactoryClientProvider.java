package com.mimecast.courier.http.client;

import com.mimecast.courier.config.TransportConfig;
import okhttp3.OkHttpClient;

/**
 * Provides pooled clients from a {@link HttpClientFactory} keyed by the configured client name.
 */
public class FactoryClientProvider implements ClientProvider {
    private final HttpClientFactory factory;

    /**
     * Constructs a new FactoryClientProvider instance.
     *
     * @param factory HttpClientFactory instance.
     */
    public FactoryClientProvider(HttpClientFactory factory) {
        this.factory = factory;
    }

    @Override
    public OkHttpClient getClient(TransportConfig config) {
        return factory.createClient(config.getClientName());
    }
}
