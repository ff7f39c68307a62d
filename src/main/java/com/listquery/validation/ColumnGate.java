package com.listquery.validation;

import com.listquery.model.ColumnAllowList;

import java.util.List;

/**
 * Checks candidate column names against an allow-list.
 */
public final class ColumnGate {

    private ColumnGate() {
    }

    /**
     * Exact, case-sensitive membership test.
     */
    public static boolean isAllowed(String name, ColumnAllowList allowList) {
        return allowList != null && allowList.contains(name);
    }

    public static boolean isAllowed(String name, List<String> allowList) {
        if (name == null || allowList == null) {
            return false;
        }
        for (String column : allowList) {
            if (name.equals(column)) {
                return true;
            }
        }
        return false;
    }
}
