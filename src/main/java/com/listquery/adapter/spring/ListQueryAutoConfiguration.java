package com.listquery.adapter.spring;

import com.listquery.config.ConfigLoader;
import com.listquery.config.ListQueryConfig;
import com.listquery.config.ResourceCatalog;
import com.listquery.request.ListQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for list-query.
 */
@Configuration
@ConditionalOnProperty(prefix = "list-query", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ListQueryProperties.class)
public class ListQueryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ListQueryAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ListQueryConfig listQueryConfig(ListQueryProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceCatalog resourceCatalog(ListQueryConfig config) {
        ResourceCatalog catalog = new ResourceCatalog(config);
        log.info("Registered list resources: {}", catalog.names());
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean
    public ListQueryParser listQueryParser(ResourceCatalog catalog, ListQueryConfig config) {
        return new ListQueryParser(catalog, config.limits(), config.pagination());
    }
}
