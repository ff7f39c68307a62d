package com.listquery.adapter.spring;

import com.listquery.config.ListQueryConfig;
import com.listquery.config.ResourceCatalog;
import com.listquery.request.ListQueryParser;
import com.listquery.request.ListQueryRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ListQueryAutoConfiguration.
 */
class ListQueryAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ListQueryAutoConfiguration.class));

    @Test
    @DisplayName("Creates parser from the configured catalog")
    void createsBeans() {
        contextRunner
                .withPropertyValues("list-query.config-path=classpath:list-query-test.yaml")
                .run(context -> {
                    assertEquals("test-service", context.getBean(ListQueryConfig.class).name());
                    assertTrue(context.getBean(ResourceCatalog.class).find("projects").isPresent());

                    ListQueryParser parser = context.getBean(ListQueryParser.class);
                    assertEquals(20, parser.parse("users", ListQueryRequest.builder().build()).limit());
                });
    }

    @Test
    @DisplayName("Defaults to the bundled catalog")
    void defaultCatalog() {
        contextRunner.run(context ->
                assertTrue(context.getBean(ResourceCatalog.class).names().contains("users")));
    }

    @Test
    @DisplayName("Disabled by property")
    void disabled() {
        contextRunner
                .withPropertyValues("list-query.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(ListQueryParser.class).isEmpty()));
    }
}
