package com.listquery.request;

import com.listquery.config.LimitsConfig;
import com.listquery.config.ListQueryConfig;
import com.listquery.config.PaginationConfig;
import com.listquery.config.ResourceCatalog;
import com.listquery.config.ResourceConfig;
import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.exception.InvalidCursorException;
import com.listquery.exception.InvalidQueryParameterException;
import com.listquery.model.FieldsExpression;
import com.listquery.model.FilterExpression;
import com.listquery.model.SortExpression;
import com.listquery.validation.DefaultValidationResult;
import com.listquery.validation.FieldsValidator;
import com.listquery.validation.FilterValidator;
import com.listquery.validation.SortValidator;
import com.listquery.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses all list parameters of a request against a configured resource.
 * <p>
 * Parameters are checked in the order sort, filter, fields, next_token, prev_token, limit,
 * and the first rejection is reported. Thread-safe.
 */
public class ListQueryParser {

    private static final Logger log = LoggerFactory.getLogger(ListQueryParser.class);

    public static final String SORT = "sort";
    public static final String FILTER = "filter";
    public static final String FIELDS = "fields";
    public static final String NEXT_TOKEN = "next_token";
    public static final String PREV_TOKEN = "prev_token";
    public static final String LIMIT = "limit";

    private final ResourceCatalog catalog;
    private final LimitsConfig limits;
    private final PaginationConfig pagination;

    public ListQueryParser(ListQueryConfig config) {
        this(new ResourceCatalog(config), config.limits(), config.pagination());
    }

    public ListQueryParser(ResourceCatalog catalog, LimitsConfig limits, PaginationConfig pagination) {
        this.catalog = catalog;
        this.limits = limits;
        this.pagination = pagination;
    }

    /**
     * Validate and parse the list parameters of one request.
     *
     * @param resourceName configured resource name
     * @param request      raw parameters
     * @return the parsed query
     * @throws InvalidQueryParameterException if any parameter is rejected
     * @throws com.listquery.exception.ConfigurationException if the resource is unknown
     */
    public ListQuery parse(String resourceName, ListQueryRequest request) {
        ResourceConfig resource = catalog.get(resourceName);

        checkLength(SORT, request.sort(), limits.maxSortLength());
        SortExpression sort;
        try {
            sort = SortValidator.parse(resource.sort(), request.sort());
        } catch (ExpressionSyntaxException e) {
            throw reject(resourceName, SORT, e);
        }

        checkLength(FILTER, request.filter(), limits.maxFilterLength());
        FilterExpression filter;
        try {
            filter = FilterValidator.parse(resource.filter(), request.filter());
        } catch (ExpressionSyntaxException e) {
            throw reject(resourceName, FILTER, e);
        }

        checkLength(FIELDS, request.fields(), limits.maxFieldsLength());
        FieldsExpression fields;
        try {
            fields = FieldsValidator.parse(resource.fields(), request.fields());
        } catch (ExpressionSyntaxException e) {
            throw reject(resourceName, FIELDS, e);
        }

        Cursor next = parseCursor(NEXT_TOKEN, request.nextToken());
        Cursor prev = parseCursor(PREV_TOKEN, request.prevToken());
        int limit = parseLimit(request.limit());

        return new ListQuery(resourceName, sort, filter, fields, next, prev, limit);
    }

    /**
     * Resolve the page size: empty or 0 means the default, values above the maximum are clamped.
     *
     * @throws InvalidQueryParameterException if the value is not an integer or is below the minimum
     */
    public int parseLimit(String raw) {
        if (raw == null || raw.isEmpty()) {
            return pagination.defaultLimit();
        }

        int limit;
        try {
            limit = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new InvalidQueryParameterException(LIMIT, DefaultValidationResult.invalid(
                    Violation.INVALID_LIMIT, raw, 0, "Limit '" + raw + "' is not an integer"));
        }

        if (limit == 0) {
            return pagination.defaultLimit();
        }
        if (limit < pagination.minLimit()) {
            throw new InvalidQueryParameterException(LIMIT, DefaultValidationResult.invalid(
                    Violation.INVALID_LIMIT, raw, 0, "Limit must be between "
                            + pagination.minLimit() + " and " + pagination.maxLimit()));
        }
        return Math.min(limit, pagination.maxLimit());
    }

    private Cursor parseCursor(String parameter, String token) {
        if (token.isEmpty()) {
            return null;
        }
        try {
            return CursorCodec.decode(token);
        } catch (InvalidCursorException e) {
            log.debug("Rejected {}: {}", parameter, e.getMessage());
            throw new InvalidQueryParameterException(parameter, DefaultValidationResult.invalid(
                    Violation.INVALID_CURSOR, token, 0, e.getMessage()));
        }
    }

    private void checkLength(String parameter, String raw, int max) {
        if (raw.length() > max) {
            throw new InvalidQueryParameterException(parameter, DefaultValidationResult.invalid(
                    Violation.TOO_LONG, "", max, parameter + " expression exceeds maximum length of "
                            + max + " characters"));
        }
    }

    private InvalidQueryParameterException reject(String resourceName, String parameter,
                                                  ExpressionSyntaxException e) {
        log.debug("Rejected {} for resource {}: {}", parameter, resourceName, e.getMessage());
        return new InvalidQueryParameterException(parameter, DefaultValidationResult.invalid(e));
    }
}
