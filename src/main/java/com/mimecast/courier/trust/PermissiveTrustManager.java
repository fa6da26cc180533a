package com.mimecast.courier.trust;

import javax.net.ssl.X509TrustManager;
import java.security.cert.X509Certificate;

/**
 * Permissive X509TrustManager implementation.
 *
 * <p>Accepts every certificate chain.
 * <br>Used as the certificate validator of clients presenting a client certificate
 * and of profiles with TLS verification disabled.
 * <p>Use only against endpoints you control.
 */
public class PermissiveTrustManager implements X509TrustManager {

    /**
     * Accepts any client certificate chain.
     *
     * @param chain    The certificate chain.
     * @param authType The authentication type.
     */
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        // Trust all clients.
    }

    /**
     * Accepts any server certificate chain.
     *
     * @param chain    The certificate chain.
     * @param authType The authentication type.
     */
    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        // Trust all servers.
    }

    /**
     * Returns an empty list of accepted issuers.
     *
     * @return Empty X509Certificate array.
     */
    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }
}
