package com.mimecast.courier.main;

import com.mimecast.courier.http.client.HttpClientFactory;
import com.mimecast.courier.http.client.PooledHttpClientFactory;
import com.mimecast.courier.trust.PermissiveTrustManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.X509TrustManager;
import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>This is a factories container for extensible components.
 * <p>You may inject yours before building transports.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Default pooled client factory.
     */
    private static final HttpClientFactory DEFAULT_CLIENT_FACTORY = new PooledHttpClientFactory();

    /**
     * HTTP client factory.
     * <p>Provides pooled clients by profile name.
     */
    private static HttpClientFactory clientFactory = DEFAULT_CLIENT_FACTORY;

    /**
     * Trust manager implementation.
     * <p>Validates server certificates for clients presenting a client certificate.
     */
    private static Callable<X509TrustManager> trustManager;

    /**
     * Protected constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets HttpClientFactory.
     *
     * @param factory HttpClientFactory instance, null restores the default.
     */
    public static void setClientFactory(HttpClientFactory factory) {
        clientFactory = factory != null ? factory : DEFAULT_CLIENT_FACTORY;
    }

    /**
     * Gets HttpClientFactory.
     *
     * @return HttpClientFactory instance.
     */
    public static HttpClientFactory getClientFactory() {
        return clientFactory;
    }

    /**
     * Sets TrustManager.
     *
     * @param callable X509TrustManager callable.
     */
    public static void setTrustManager(Callable<X509TrustManager> callable) {
        trustManager = callable;
    }

    /**
     * Gets TrustManager.
     * <p>Falls back to {@link PermissiveTrustManager} when none is set or it fails to build.
     *
     * @return X509TrustManager instance.
     */
    public static X509TrustManager getTrustManager() {
        if (trustManager != null) {
            try {
                return trustManager.call();
            } catch (Exception e) {
                log.error("Error calling trust manager: {}", e.getMessage());
            }
        }

        return new PermissiveTrustManager();
    }
}
