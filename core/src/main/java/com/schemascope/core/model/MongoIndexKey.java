package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One field of an index key; direction is 1 for ascending and -1 for descending.
 */
public record MongoIndexKey(
        @JsonProperty("field") String field,
        @JsonProperty("direction") int direction
) {}
