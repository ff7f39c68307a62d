package com.listquery.validation;

import com.listquery.model.ColumnAllowList;

import java.util.List;

/**
 * Accept/reject facade over the fields, sort and filter validators.
 * <p>
 * Every method is a pure function of its arguments and never throws for any input string.
 */
public final class QueryValidators {

    private QueryValidators() {
    }

    /**
     * Example: {@code isValidFields(List.of("id", "first_name"), "id, first_name")}.
     */
    public static boolean isValidFields(List<String> allowList, String fields) {
        return FieldsValidator.isValid(ColumnAllowList.of(allowList), fields);
    }

    /**
     * Example: {@code isValidSort(List.of("id", "created_at"), "id ASC, created_at DESC")}.
     */
    public static boolean isValidSort(List<String> allowList, String sort) {
        return SortValidator.isValid(ColumnAllowList.of(allowList), sort);
    }

    /**
     * Example: {@code isValidFilter(List.of("id", "first_name"), "id=1 AND first_name='Alice'")}.
     */
    public static boolean isValidFilter(List<String> allowList, String filter) {
        return FilterValidator.isValid(ColumnAllowList.of(allowList), filter);
    }

    public static ValidationResult validateFields(List<String> allowList, String fields) {
        return FieldsValidator.validate(ColumnAllowList.of(allowList), fields);
    }

    public static ValidationResult validateSort(List<String> allowList, String sort) {
        return SortValidator.validate(ColumnAllowList.of(allowList), sort);
    }

    public static ValidationResult validateFilter(List<String> allowList, String filter) {
        return FilterValidator.validate(ColumnAllowList.of(allowList), filter);
    }
}
