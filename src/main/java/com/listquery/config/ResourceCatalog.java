package com.listquery.config;

import com.listquery.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only index of configured resources by name.
 */
public class ResourceCatalog {

    private final Map<String, ResourceConfig> resources;

    public ResourceCatalog(ListQueryConfig config) {
        Map<String, ResourceConfig> byName = new LinkedHashMap<>();
        for (ResourceConfig resource : config.resources()) {
            byName.put(resource.name(), resource);
        }
        this.resources = Collections.unmodifiableMap(byName);
    }

    /**
     * Get resource by name.
     *
     * @throws ConfigurationException if no resource has this name
     */
    public ResourceConfig get(String name) {
        return find(name).orElseThrow(() -> new ConfigurationException("Unknown resource '" + name
                + "'. Define it under list-query.resources."));
    }

    public Optional<ResourceConfig> find(String name) {
        return Optional.ofNullable(resources.get(name));
    }

    public Set<String> names() {
        return resources.keySet();
    }
}
