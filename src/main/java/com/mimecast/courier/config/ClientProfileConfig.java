package com.mimecast.courier.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Client profile configuration.
 *
 * <p>This class provides type safe access to a named HTTP client profile.
 * <p>Pooled clients are built once per profile and reused by every transport naming it.
 */
public class ClientProfileConfig extends BasicConfig {

    /**
     * Constructs a new ClientProfileConfig instance with all defaults.
     *
     * @param name Profile name.
     */
    public ClientProfileConfig(String name) {
        super(new HashMap<>());
        map.put("name", name);
    }

    /**
     * Constructs a new ClientProfileConfig instance.
     *
     * @param map Configuration map.
     */
    public ClientProfileConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets profile name.
     *
     * @return Name string.
     */
    public String getName() {
        return getStringProperty("name", TransportConfig.DEFAULT_CLIENT);
    }

    /**
     * Gets connect timeout.
     *
     * @return Timeout in seconds.
     */
    public long getConnectTimeout() {
        return getLongProperty("connectTimeout", 30L);
    }

    /**
     * Gets read timeout.
     *
     * @return Timeout in seconds.
     */
    public long getReadTimeout() {
        return getLongProperty("readTimeout", 30L);
    }

    /**
     * Gets write timeout.
     *
     * @return Timeout in seconds.
     */
    public long getWriteTimeout() {
        return getLongProperty("writeTimeout", 30L);
    }

    /**
     * Gets call timeout.
     *
     * @return Timeout in seconds, 0 for none.
     */
    public long getCallTimeout() {
        return getLongProperty("callTimeout", 0L);
    }

    /**
     * Checks if redirects should be followed.
     *
     * @return Boolean.
     */
    public boolean isFollowRedirects() {
        return getBooleanProperty("followRedirects", true);
    }

    /**
     * Checks if TLS verification should be skipped.
     *
     * @return Boolean.
     */
    public boolean isSkipTlsVerification() {
        return getBooleanProperty("skipTlsVerification", false);
    }

    /**
     * Gets maximum idle pooled connections.
     *
     * @return Connection count.
     */
    public int getMaxIdleConnections() {
        return Math.toIntExact(getLongProperty("maxIdleConnections", 5L));
    }

    /**
     * Gets pooled connection keep alive.
     *
     * @return Keep alive in seconds.
     */
    public long getKeepAlive() {
        return getLongProperty("keepAlive", 300L);
    }
}
