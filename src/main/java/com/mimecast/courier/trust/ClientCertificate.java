package com.mimecast.courier.trust;

import com.mimecast.courier.config.CertificateConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.X509TrustManager;
import java.io.FileInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;

/**
 * Client certificate loaded from a key store.
 *
 * <p>Provides the key managers presenting the certificate during the TLS handshake
 * <br>and builds an SSLContext pairing them with a certificate validator.
 */
public class ClientCertificate {
    private static final Logger log = LogManager.getLogger(ClientCertificate.class);

    private final String path;
    private final KeyManager[] keyManagers;

    /**
     * Constructs a new ClientCertificate instance.
     *
     * @param config Certificate configuration.
     * @throws GeneralSecurityException If the key store cannot be initialized.
     * @throws IOException              If the key store cannot be read.
     */
    public ClientCertificate(CertificateConfig config) throws GeneralSecurityException, IOException {
        this.path = config.getPath();
        char[] password = config.getPassword().toCharArray();

        KeyStore keyStore = KeyStore.getInstance(config.getType());
        try (FileInputStream fis = new FileInputStream(path)) {
            keyStore.load(fis, password);
        }

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, password);
        this.keyManagers = kmf.getKeyManagers();

        log.debug("Loaded client certificate store: {} with {} entries", path, keyStore.size());
    }

    /**
     * Gets key store path.
     *
     * @return Path string.
     */
    public String getPath() {
        return path;
    }

    /**
     * Gets key managers.
     *
     * @return KeyManager array.
     */
    public KeyManager[] getKeyManagers() {
        return keyManagers;
    }

    /**
     * Builds a TLS context presenting this certificate.
     *
     * @param trustManager Server certificate validator.
     * @return SSLContext instance.
     * @throws GeneralSecurityException If the context cannot be initialized.
     */
    public SSLContext getSslContext(X509TrustManager trustManager) throws GeneralSecurityException {
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(keyManagers, new javax.net.ssl.TrustManager[]{trustManager}, new SecureRandom());
        return sslContext;
    }
}
