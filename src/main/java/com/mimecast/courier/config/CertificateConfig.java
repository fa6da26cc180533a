package com.mimecast.courier.config;

import java.util.Map;

/**
 * Client certificate configuration.
 *
 * <p>Points to a key store holding the client key and certificate chain.
 */
public class CertificateConfig extends BasicConfig {

    /**
     * Constructs a new CertificateConfig instance.
     *
     * @param map Configuration map.
     */
    public CertificateConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets key store path.
     *
     * @return Path string.
     */
    public String getPath() {
        return getStringProperty("path", "");
    }

    /**
     * Gets key store password.
     *
     * @return Password string.
     */
    public String getPassword() {
        return getStringProperty("password", "");
    }

    /**
     * Gets key store type.
     *
     * @return Key store type, PKCS12 by default.
     */
    public String getType() {
        return getStringProperty("type", "PKCS12");
    }

    /**
     * Gets server trust store path.
     * <p>When blank the server is validated by the default certificate validator.
     *
     * @return Path string.
     */
    public String getTrustStore() {
        return getStringProperty("trustStore", "");
    }

    /**
     * Gets server trust store password or path to a file holding it.
     *
     * @return Password string.
     */
    public String getTrustStorePassword() {
        return getStringProperty("trustStorePassword", "");
    }
}
