package com.listquery.config;

import java.util.List;

/**
 * Root configuration for list-query.
 *
 * @param name       Service name identifier
 * @param version    Configuration version
 * @param limits     Expression length limits
 * @param pagination Page size bounds
 * @param resources  Listable resources and their allow-lists
 */
public record ListQueryConfig(
        String name,
        String version,
        LimitsConfig limits,
        PaginationConfig pagination,
        List<ResourceConfig> resources
) {
    public ListQueryConfig {
        resources = List.copyOf(resources);
    }

    /**
     * Create a configuration with default limits for the given resources.
     */
    public static ListQueryConfig of(ResourceConfig... resources) {
        return new ListQueryConfig(
                "list-query",
                "1.0",
                LimitsConfig.defaults(),
                PaginationConfig.defaults(),
                List.of(resources)
        );
    }
}
