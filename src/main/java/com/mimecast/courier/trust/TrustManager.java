package com.mimecast.courier.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * Trust store backed X509TrustManager implementation.
 *
 * <p>Validates server certificates against a trust store file.
 * <br>Only certificates issued by the Certificate Authorities in the store are accepted.
 * <p>The password may be given as text or as a path to a file holding it.
 */
public class TrustManager implements X509TrustManager {
    private static final Logger log = LogManager.getLogger(TrustManager.class);

    private final X509TrustManager defaultTrustManager;

    /**
     * Constructs a new TrustManager from a trust store file.
     *
     * @param trustStore         Trust store path.
     * @param trustStorePassword Trust store password or password file path.
     * @throws GeneralSecurityException If the trust store cannot be initialized.
     * @throws IOException              If the trust store cannot be read.
     */
    public TrustManager(String trustStore, String trustStorePassword) throws GeneralSecurityException, IOException {
        String password;
        try {
            password = Files.readString(Paths.get(trustStorePassword)).trim();
        } catch (IOException | RuntimeException e) {
            log.debug("Truststore password treated as text.");
            password = trustStorePassword;
        }

        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        try (FileInputStream fis = new FileInputStream(trustStore)) {
            store.load(fis, password.toCharArray());
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(store);

        X509TrustManager x509Tm = null;
        for (javax.net.ssl.TrustManager tm : tmf.getTrustManagers()) {
            if (tm instanceof X509TrustManager) {
                x509Tm = (X509TrustManager) tm;
                break;
            }
        }
        if (x509Tm == null) {
            throw new GeneralSecurityException("No X509TrustManager found");
        }
        this.defaultTrustManager = x509Tm;
    }

    /**
     * Validates the client's certificate chain.
     *
     * @param chain    The certificate chain to validate.
     * @param authType The authentication type (e.g., "RSA").
     * @throws CertificateException If the certificate chain is not trusted.
     */
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        defaultTrustManager.checkClientTrusted(chain, authType);
    }

    /**
     * Validates the server's certificate chain.
     *
     * @param chain    The certificate chain to validate.
     * @param authType The authentication type (e.g., "RSA").
     * @throws CertificateException If the certificate chain is not trusted.
     */
    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        defaultTrustManager.checkServerTrusted(chain, authType);
    }

    /**
     * Returns the list of accepted issuers (trusted CAs).
     *
     * @return Array of X509Certificate representing the accepted issuers.
     */
    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return defaultTrustManager.getAcceptedIssuers();
    }
}
