package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MongoIndex(
        @JsonProperty("name") String name,
        @JsonProperty("keys") List<MongoIndexKey> keys,
        @JsonProperty("unique") boolean unique
) {
    public MongoIndex {
        keys = List.copyOf(keys);
    }
}
