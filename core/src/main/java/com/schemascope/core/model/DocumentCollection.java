package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * One collection of a document database. Indexes and the sample document are part of the output
 * contract but are not read yet, so both stay empty and are omitted from the JSON.
 */
@JsonPropertyOrder({"collectionName", "databaseName", "indexes", "sampleDocument"})
public record DocumentCollection(
        @JsonProperty("collectionName") String collectionName,
        @JsonProperty("databaseName") String databaseName,
        @JsonProperty("indexes") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<MongoIndex> indexes,
        @JsonProperty("sampleDocument") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> sampleDocument
) {
    public DocumentCollection {
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        sampleDocument = sampleDocument == null ? Map.of() : Map.copyOf(sampleDocument);
    }

    public static DocumentCollection named(String collectionName, String databaseName) {
        return new DocumentCollection(collectionName, databaseName, List.of(), Map.of());
    }
}
