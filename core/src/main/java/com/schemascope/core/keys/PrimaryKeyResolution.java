package com.schemascope.core.keys;

import java.util.List;
import java.util.Set;

/**
 * Outcome of running the strategy list for one table. When every strategy failed the column set
 * is empty and {@code strategy} is null.
 *
 * @param strategy name of the strategy that answered
 * @param columns  primary-key column names
 * @param failures one message per strategy that failed before the answer, in order
 */
public record PrimaryKeyResolution(String strategy, Set<String> columns, List<String> failures) {

    public PrimaryKeyResolution {
        columns = Set.copyOf(columns);
        failures = List.copyOf(failures);
    }

    public static PrimaryKeyResolution resolved(String strategy, Set<String> columns, List<String> failures) {
        return new PrimaryKeyResolution(strategy, columns, failures);
    }

    public static PrimaryKeyResolution unresolved(List<String> failures) {
        return new PrimaryKeyResolution(null, Set.of(), failures);
    }

    public boolean isResolved() {
        return strategy != null;
    }
}
