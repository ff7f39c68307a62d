package com.listquery.config;

import com.listquery.exception.ConfigurationException;
import com.listquery.model.ColumnAllowList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the resource catalog from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ListQueryConfig load(String path) {
        log.info("Loading list-query configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static ListQueryConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration file is not a YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The list-query section can be at root or under 'list-query' key
        Map<String, Object> section = root.containsKey("list-query")
                ? getMap(root, "list-query")
                : root;
        if (section == null) {
            throw new ConfigurationException("'list-query' section is empty");
        }

        String name = getString(section, "name", "list-query");
        String version = getString(section, "version", "1.0");
        LimitsConfig limits = parseLimits(getMap(section, "limits"));
        PaginationConfig pagination = parsePagination(getMap(section, "pagination"));
        List<ResourceConfig> resources = parseResources(section.get("resources"));

        if (resources.isEmpty()) {
            log.warn("No resources configured, every list parameter will be rejected");
        }

        ListQueryConfig config = new ListQueryConfig(name, version, limits, pagination, resources);

        log.info("Loaded list-query configuration: {} v{} with {} resources, limit {}..{} (default {})",
                name, version, resources.size(), pagination.minLimit(), pagination.maxLimit(),
                pagination.defaultLimit());

        return config;
    }

    private static LimitsConfig parseLimits(Map<String, Object> map) {
        if (map == null) {
            return LimitsConfig.defaults();
        }
        LimitsConfig defaults = LimitsConfig.defaults();
        LimitsConfig limits = new LimitsConfig(
                getInt(map, "max-filter-length", defaults.maxFilterLength()),
                getInt(map, "max-sort-length", defaults.maxSortLength()),
                getInt(map, "max-fields-length", defaults.maxFieldsLength())
        );
        if (limits.maxFilterLength() <= 0 || limits.maxSortLength() <= 0 || limits.maxFieldsLength() <= 0) {
            throw new ConfigurationException("Expression length limits must be positive: " + limits);
        }
        return limits;
    }

    private static PaginationConfig parsePagination(Map<String, Object> map) {
        if (map == null) {
            return PaginationConfig.defaults();
        }
        PaginationConfig defaults = PaginationConfig.defaults();
        int minLimit = getInt(map, "min-limit", defaults.minLimit());
        int maxLimit = getInt(map, "max-limit", defaults.maxLimit());
        int defaultLimit = getInt(map, "default-limit", defaults.defaultLimit());

        if (minLimit < 1) {
            throw new ConfigurationException("pagination.min-limit must be one or greater, got " + minLimit);
        }
        if (minLimit > maxLimit) {
            throw new ConfigurationException("pagination.min-limit " + minLimit
                    + " is greater than pagination.max-limit " + maxLimit);
        }
        if (defaultLimit < minLimit || defaultLimit > maxLimit) {
            throw new ConfigurationException("pagination.default-limit " + defaultLimit
                    + " must be between " + minLimit + " and " + maxLimit);
        }
        return new PaginationConfig(defaultLimit, minLimit, maxLimit);
    }

    @SuppressWarnings("unchecked")
    private static List<ResourceConfig> parseResources(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'resources' must be a list of resource mappings");
        }
        List<ResourceConfig> resources = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?>)) {
                throw new ConfigurationException("Resource at index " + i + " must be a mapping, got '"
                        + list.get(i) + "'");
            }
            Map<String, Object> map = (Map<String, Object>) list.get(i);
            String name = getString(map, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Resource at index " + i + " has no name");
            }
            if (!names.add(name)) {
                throw new ConfigurationException("Duplicate resource '" + name + "'");
            }

            ColumnAllowList fields = getColumns(map, "fields", null);
            if (fields == null || fields.isEmpty()) {
                throw new ConfigurationException("Resource '" + name + "' declares no fields");
            }
            // sort and filter default to the fields allow-list
            ColumnAllowList sort = getColumns(map, "sort", fields);
            ColumnAllowList filter = getColumns(map, "filter", fields);

            resources.add(new ResourceConfig(name, fields, sort, filter));
            log.debug("Parsed resource: name={}, fields={}, sort={}, filter={}", name, fields, sort, filter);
        }
        return resources;
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'" + key + "' must be a mapping, got '" + value + "'");
        }
        return (Map<String, Object>) value;
    }

    private static ColumnAllowList getColumns(Map<String, Object> map, String key, ColumnAllowList defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (!(value instanceof List<?> items)) {
            throw new ConfigurationException("'" + key + "' must be a list of column names");
        }
        List<String> columns = new ArrayList<>();
        for (Object item : items) {
            if (item == null || item.toString().isBlank()) {
                throw new ConfigurationException("'" + key + "' contains a blank column name");
            }
            columns.add(item.toString());
        }
        return ColumnAllowList.of(columns);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer i) return i;
        // longs, decimals and out-of-range strings all fail here
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer between "
                    + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE + ", got '" + value + "'", e);
        }
    }
}
