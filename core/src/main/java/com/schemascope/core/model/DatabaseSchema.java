package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemascope.core.BackendKind;

import java.util.List;

@JsonPropertyOrder({"databaseName", "dbType", "defaultSchema", "tables"})
public record DatabaseSchema(
        @JsonProperty("databaseName") String databaseName,
        @JsonProperty("dbType") BackendKind dbType,
        @JsonProperty("defaultSchema") String defaultSchema,
        @JsonProperty("tables") List<Table> tables
) implements SchemaSnapshot {
    public DatabaseSchema {
        tables = List.copyOf(tables);
    }
}
