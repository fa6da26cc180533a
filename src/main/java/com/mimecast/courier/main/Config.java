package com.mimecast.courier.main;

import com.mimecast.courier.config.ProfilesConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the client profiles used by the pooled HTTP client factory.
 * <p>Profiles are empty until initialized so every client name resolves to defaults.
 *
 * @see ProfilesConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Client profiles configuration.
     */
    private static ProfilesConfig profiles = new ProfilesConfig();

    /**
     * Gets client profiles.
     *
     * @return ProfilesConfig.
     */
    public static ProfilesConfig getProfiles() {
        return profiles;
    }

    /**
     * Init client profiles.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initProfiles(String path) throws IOException {
        profiles = new ProfilesConfig(path);
        log.info("Loaded {} client profiles from: {}", profiles.getProfiles().size(), path);
    }

    /**
     * Sets client profiles.
     *
     * @param config ProfilesConfig instance.
     */
    public static void setProfiles(ProfilesConfig config) {
        profiles = config;
    }
}
