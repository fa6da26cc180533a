package com.mimecast.courier.http.client;

import com.mimecast.courier.config.CertificateConfig;
import com.mimecast.courier.config.TransportConfig;
import com.mimecast.courier.http.ErrorKind;
import com.mimecast.courier.http.TransportException;
import com.mimecast.courier.trust.ClientCertificate;
import com.mimecast.courier.trust.PermissiveTrustManager;
import com.mimecast.courier.trust.TrustManager;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Builds a fresh HTTP client for every execution.
 *
 * <p>The call timeout is the configured transport timeout or {@link #DEFAULT_TIMEOUT} seconds.
 * <p>When a client certificate is configured the client presents it and validates the server
 * <br>with the certificate trust store when one is configured, or the supplied certificate validator otherwise.
 */
public class AdHocClientProvider implements ClientProvider {
    private static final Logger log = LogManager.getLogger(AdHocClientProvider.class);

    /**
     * Default call timeout in seconds.
     */
    public static final long DEFAULT_TIMEOUT = 60L;

    private final Supplier<X509TrustManager> trustManager;

    /**
     * Constructs a new AdHocClientProvider instance.
     *
     * @param trustManager Certificate validator supplier.
     */
    public AdHocClientProvider(Supplier<X509TrustManager> trustManager) {
        this.trustManager = trustManager;
    }

    @Override
    public OkHttpClient getClient(TransportConfig config) throws TransportException {
        long timeout = config.getTimeout() > 0 ? config.getTimeout() : DEFAULT_TIMEOUT;
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .callTimeout(timeout, TimeUnit.SECONDS);

        CertificateConfig certificate = config.getCertificate();
        if (certificate != null) {
            try {
                X509TrustManager validator = StringUtils.isNotBlank(certificate.getTrustStore())
                        ? new TrustManager(certificate.getTrustStore(), certificate.getTrustStorePassword())
                        : trustManager.get();
                SSLContext sslContext = new ClientCertificate(certificate).getSslContext(validator);
                builder.sslSocketFactory(sslContext.getSocketFactory(), validator);
                if (validator instanceof PermissiveTrustManager) {
                    builder.hostnameVerifier((hostname, session) -> true);
                }
                log.debug("Client certificate {} wired with {}", certificate.getPath(), validator.getClass().getSimpleName());
            } catch (GeneralSecurityException | IOException e) {
                throw new TransportException(ErrorKind.CONFIGURATION,
                        "Unable to load client certificate " + certificate.getPath() + ": " + e.getMessage(), e);
            }
        }

        return builder.build();
    }

    @Override
    public void release(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
