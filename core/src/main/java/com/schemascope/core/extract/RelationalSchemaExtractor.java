package com.schemascope.core.extract;

import com.schemascope.core.ExtractionStage;
import com.schemascope.core.SchemaAssembler;
import com.schemascope.core.SchemaExtractionException;
import com.schemascope.core.dialect.CatalogQuery;
import com.schemascope.core.dialect.Dialect;
import com.schemascope.core.dialect.TableRef;
import com.schemascope.core.keys.PrimaryKeyResolution;
import com.schemascope.core.keys.PrimaryKeyResolver;
import com.schemascope.core.model.Column;
import com.schemascope.core.model.DatabaseSchema;
import com.schemascope.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reads the base tables of one schema and their columns through a {@link Dialect}.
 *
 * <p>The table list is read completely before the first column query runs, so the connection
 * never has two cursors open. Tables are processed one at a time in discovery order. Any failure
 * aborts the run.
 */
public class RelationalSchemaExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RelationalSchemaExtractor.class);

    private final Dialect dialect;

    public RelationalSchemaExtractor(Dialect dialect) {
        this.dialect = dialect;
    }

    public DatabaseSchema extract(Connection conn, String databaseName, String defaultSchema)
            throws SchemaExtractionException {
        logger.info("Extracting {} schema of database {} (default schema {})",
                dialect.kind(), databaseName, defaultSchema);

        List<TableRef> refs = listTables(conn, defaultSchema);
        logger.info("Found {} tables", refs.size());

        List<Table> tables = new ArrayList<>(refs.size());
        for (TableRef ref : refs) {
            List<Column> columns = extractColumns(conn, ref);
            tables.add(new Table(ref.name(), ref.schema(), columns));
            logger.info("Processed table {} ({} columns)", ref.qualifiedName(), columns.size());
        }

        return SchemaAssembler.relational(databaseName, dialect.kind(), defaultSchema, tables);
    }

    List<TableRef> listTables(Connection conn, String defaultSchema) throws SchemaExtractionException {
        String target = "schema " + defaultSchema;
        Set<TableRef> refs = new LinkedHashSet<>();
        try (PreparedStatement stmt = prepare(conn, () -> dialect.tableQuery(defaultSchema));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                TableRef ref = dialect.decodeTableRow(rs);
                if (!refs.add(ref)) {
                    throw new SQLDataException("Table listed twice: " + ref.qualifiedName());
                }
            }
        } catch (SQLException e) {
            throw new SchemaExtractionException(ExtractionStage.LIST_TABLES, target, e);
        }
        return new ArrayList<>(refs);
    }

    List<Column> extractColumns(Connection conn, TableRef ref) throws SchemaExtractionException {
        List<Column> columns = new ArrayList<>();
        Set<String> names = new HashSet<>();

        try (PreparedStatement stmt = prepare(conn, () -> dialect.columnQuery(ref.schema(), ref.name()));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                Column column = decode(rs, ref);
                if (!names.add(column.columnName())) {
                    throw new SchemaExtractionException(ExtractionStage.DECODE_COLUMN, ref.qualifiedName(),
                            new SQLDataException("Column listed twice: " + column.columnName()));
                }
                columns.add(column);
            }
        } catch (SQLException e) {
            throw new SchemaExtractionException(ExtractionStage.LIST_COLUMNS, ref.qualifiedName(), e);
        }

        Optional<PrimaryKeyResolver> resolver = dialect.primaryKeyResolver();
        if (resolver.isPresent()) {
            PrimaryKeyResolution resolution = resolver.get().resolve(conn, ref.schema(), ref.name());
            columns = mergePrimaryKeys(columns, resolution.columns());
        }
        return columns;
    }

    /**
     * Marks the named columns as primary-key members. Names with no matching column are ignored.
     */
    static List<Column> mergePrimaryKeys(List<Column> columns, Set<String> primaryKeyColumns) {
        if (primaryKeyColumns.isEmpty()) {
            return columns;
        }
        List<Column> merged = new ArrayList<>(columns.size());
        for (Column column : columns) {
            merged.add(primaryKeyColumns.contains(column.columnName()) ? column.withPrimaryKey(true) : column);
        }
        return merged;
    }

    private Column decode(ResultSet rs, TableRef ref) throws SchemaExtractionException {
        try {
            return dialect.decodeColumn(rs);
        } catch (SQLException e) {
            throw new SchemaExtractionException(ExtractionStage.DECODE_COLUMN, ref.qualifiedName(), e);
        }
    }

    private static PreparedStatement prepare(Connection conn, Supplier<CatalogQuery> supplier) throws SQLException {
        CatalogQuery query;
        try {
            query = supplier.get();
        } catch (IllegalArgumentException e) {
            throw new SQLException(e.getMessage(), e);
        }
        return query.prepare(conn);
    }
}
