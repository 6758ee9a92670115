package com.modelspec.adapter.spring;

import com.modelspec.live.LiveModelResolver;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the model specification engine.
 */
@ConfigurationProperties(prefix = "modelspec")
public class ModelSpecProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the model definition file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:model-spec.yaml";

    /**
     * Debounce window for live formula resolution.
     */
    private long debounceMillis = LiveModelResolver.DEFAULT_DEBOUNCE_MILLIS;

    /**
     * Character joining identifiers into an explicit interaction.
     */
    private String interactionMarker = ":";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public String getInteractionMarker() {
        return interactionMarker;
    }

    public void setInteractionMarker(String interactionMarker) {
        this.interactionMarker = interactionMarker;
    }
}
