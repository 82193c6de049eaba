package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"tableName", "schema", "columns"})
public record Table(
        @JsonProperty("tableName") String tableName,
        @JsonProperty("schema") String schema,
        @JsonProperty("columns") List<Column> columns
) {
    public Table {
        columns = List.copyOf(columns);
    }
}
