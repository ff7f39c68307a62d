package com.listquery.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for list-query.
 */
@ConfigurationProperties(prefix = "list-query")
public class ListQueryProperties {

    /**
     * Whether list-query is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the resource catalog file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:list-query.yaml";

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
}
