package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemascope.core.BackendKind;

import java.util.List;

@JsonPropertyOrder({"databaseName", "dbType", "collections"})
public record CollectionSchema(
        @JsonProperty("databaseName") String databaseName,
        @JsonProperty("dbType") BackendKind dbType,
        @JsonProperty("collections") List<DocumentCollection> collections
) implements SchemaSnapshot {
    public CollectionSchema {
        collections = List.copyOf(collections);
    }
}
