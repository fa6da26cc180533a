package com.mimecast.courier.http.client;

import com.mimecast.courier.config.ClientProfileConfig;
import com.mimecast.courier.config.ProfilesConfig;
import com.mimecast.courier.main.Config;
import com.mimecast.courier.trust.PermissiveTrustManager;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Pooled HTTP client factory.
 *
 * <p>Builds one client per profile name and reuses it for every later call.
 * <br>All clients share the dispatcher of a root client while each profile keeps its own connection pool.
 *
 * @see ClientProfileConfig
 */
public class PooledHttpClientFactory implements HttpClientFactory {
    private static final Logger log = LogManager.getLogger(PooledHttpClientFactory.class);

    private final Supplier<ProfilesConfig> profiles;
    private final OkHttpClient root = new OkHttpClient();
    private final Map<String, OkHttpClient> clients = new ConcurrentHashMap<>();

    /**
     * Constructs a new PooledHttpClientFactory instance using the profiles from {@link Config}.
     */
    public PooledHttpClientFactory() {
        this(Config::getProfiles);
    }

    /**
     * Constructs a new PooledHttpClientFactory instance.
     *
     * @param profiles Profiles configuration supplier.
     */
    public PooledHttpClientFactory(Supplier<ProfilesConfig> profiles) {
        this.profiles = profiles;
    }

    @Override
    public OkHttpClient createClient(String name) {
        return clients.computeIfAbsent(name, key -> build(profiles.get().getProfile(key)));
    }

    /**
     * Builds client for profile.
     *
     * @param profile ClientProfileConfig instance.
     * @return OkHttpClient instance.
     */
    OkHttpClient build(ClientProfileConfig profile) {
        OkHttpClient.Builder builder = root.newBuilder()
                .connectionPool(new ConnectionPool(profile.getMaxIdleConnections(), profile.getKeepAlive(), TimeUnit.SECONDS))
                .connectTimeout(profile.getConnectTimeout(), TimeUnit.SECONDS)
                .readTimeout(profile.getReadTimeout(), TimeUnit.SECONDS)
                .writeTimeout(profile.getWriteTimeout(), TimeUnit.SECONDS)
                .callTimeout(profile.getCallTimeout(), TimeUnit.SECONDS)
                .followRedirects(profile.isFollowRedirects())
                .followSslRedirects(profile.isFollowRedirects());

        if (profile.isSkipTlsVerification()) {
            configureTrustAllCerts(builder, profile.getName());
        }

        log.debug("Built HTTP client for profile: {}", profile.getName());
        return builder.build();
    }

    /**
     * Configure the HTTP client to trust all certificates.
     *
     * @param builder OkHttpClient.Builder to configure.
     * @param name    Profile name.
     */
    private void configureTrustAllCerts(OkHttpClient.Builder builder, String name) {
        try {
            X509TrustManager trustManager = new PermissiveTrustManager();
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new javax.net.ssl.TrustManager[]{trustManager}, new SecureRandom());
            builder.sslSocketFactory(sslContext.getSocketFactory(), trustManager);
            builder.hostnameVerifier((hostname, session) -> true);

            log.warn("TLS verification disabled for client profile {} - use only in development!", name);
        } catch (GeneralSecurityException e) {
            log.error("Failed to configure trust all certificates for client profile {}: {}", name, e.getMessage());
        }
    }

    /**
     * Gets the number of clients built so far.
     *
     * @return Integer.
     */
    public int size() {
        return clients.size();
    }

    /**
     * Closes idle connections of every client and forgets them.
     */
    public void shutdown() {
        clients.values().forEach(client -> client.connectionPool().evictAll());
        clients.clear();
    }
}
