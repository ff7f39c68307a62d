package com.listquery;

import com.listquery.exception.InvalidQueryParameterException;
import com.listquery.request.ListQuery;
import com.listquery.request.ListQueryParser;
import com.listquery.request.ListQueryRequest;
import com.listquery.request.ValidationErrorRenderer;
import com.listquery.spring.EnableListQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating list-query usage.
 */
@SpringBootApplication
@EnableListQuery
public class ListQueryApplication {

    private static final Logger log = LoggerFactory.getLogger(ListQueryApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ListQueryApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ListQueryParser parser) {
        return args -> {
            log.info("=== list-query Demo Started ===");

            List<ListQueryRequest> requests = List.of(
                    ListQueryRequest.builder()
                            .sort("created_at DESC, last_name ASC")
                            .filter("disabled=0 AND first_name='Alice' OR last_name='O''Brien'")
                            .fields("id, first_name, email")
                            .limit("25")
                            .build(),
                    ListQueryRequest.builder().sort("id").build(),
                    ListQueryRequest.builder().filter("id=1 AND").build(),
                    ListQueryRequest.builder().filter("password='secret'").build(),
                    ListQueryRequest.builder().limit("5000").build()
            );

            for (ListQueryRequest request : requests) {
                try {
                    ListQuery query = parser.parse("users", request);
                    log.info("Accepted: sort=[{}] filter=[{}] fields={} limit={}",
                            query.sort(), query.filter(), query.fields().columns(), query.limit());
                } catch (InvalidQueryParameterException e) {
                    log.info("Rejected with 400: {}", ValidationErrorRenderer.render(e));
                }
            }

            log.info("=== list-query Demo Completed ===");
        };
    }
}
