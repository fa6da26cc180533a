package com.mimecast.courier.config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client profiles configuration container.
 *
 * <p>Holds the named client profiles used to build pooled HTTP clients.
 * <p>Unknown names resolve to a profile with all defaults.
 *
 * @see ClientProfileConfig
 */
@SuppressWarnings("unchecked")
public class ProfilesConfig extends ConfigFoundation {
    private final List<ClientProfileConfig> profiles = new ArrayList<>();

    /**
     * Constructs a new ProfilesConfig instance.
     */
    public ProfilesConfig() {
        super();
    }

    /**
     * Constructs a new ProfilesConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public ProfilesConfig(Map<String, Object> map) {
        super(map);
        loadProfiles();
    }

    /**
     * Constructs a new ProfilesConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ProfilesConfig(String path) throws IOException {
        super(path);
        loadProfiles();
    }

    /**
     * Populates profiles list from config map.
     */
    private void loadProfiles() {
        for (Object entry : getListProperty("profiles")) {
            if (entry instanceof Map) {
                profiles.add(new ClientProfileConfig((Map<String, Object>) entry));
            }
        }
    }

    /**
     * Gets all configured profiles.
     *
     * @return List of ClientProfileConfig.
     */
    public List<ClientProfileConfig> getProfiles() {
        return profiles;
    }

    /**
     * Gets profile by name.
     *
     * @param name Profile name.
     * @return ClientProfileConfig instance, defaults if not configured.
     */
    public ClientProfileConfig getProfile(String name) {
        return profiles.stream()
                .filter(profile -> profile.getName().equals(name))
                .findFirst()
                .orElseGet(() -> {
                    log.debug("No client profile named {}, using defaults", name);
                    return new ClientProfileConfig(name);
                });
    }
}
