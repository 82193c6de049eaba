package com.schemascope.core.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tries an ordered list of {@link PrimaryKeyStrategy} values until one runs successfully. A
 * strategy that runs and finds nothing is a valid answer; only a strategy that fails to run hands
 * over to the next one. When the list is exhausted the table is treated as having no primary key.
 */
public class PrimaryKeyResolver {
    private static final Logger logger = LoggerFactory.getLogger(PrimaryKeyResolver.class);

    private final List<PrimaryKeyStrategy> strategies;

    public PrimaryKeyResolver(List<PrimaryKeyStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<PrimaryKeyStrategy> strategies() {
        return strategies;
    }

    public PrimaryKeyResolution resolve(Connection conn, String schema, String table) {
        List<String> failures = new ArrayList<>();
        for (PrimaryKeyStrategy strategy : strategies) {
            try {
                Set<String> columns = strategy.primaryKeyColumns(conn, schema, table);
                logger.debug("Primary key of {}.{} via {}: {}", schema, table, strategy.name(), columns);
                return PrimaryKeyResolution.resolved(strategy.name(), columns, failures);
            } catch (SQLException e) {
                logger.debug("Primary key strategy {} failed for {}.{}", strategy.name(), schema, table, e);
                failures.add(strategy.name() + ": " + e.getMessage());
            }
        }

        logger.warn("Could not determine primary key of {}.{}, marking no columns as key: {}",
                schema, table, failures);
        return PrimaryKeyResolution.unresolved(failures);
    }
}
