package com.schemascope.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One column as reported by the catalog. Length, precision and scale are null when the catalog
 * reported nothing for them and are then left out of the JSON entirely.
 */
@JsonPropertyOrder({"columnName", "dataType", "isNullable", "maxLength", "precision", "scale",
        "isPrimaryKey", "isIdentity", "defaultValue"})
public record Column(
        @JsonProperty("columnName") String columnName,
        @JsonProperty("dataType") String dataType,
        @JsonProperty("isNullable") String isNullable,
        @JsonProperty("maxLength") @JsonInclude(JsonInclude.Include.NON_NULL) Long maxLength,
        @JsonProperty("precision") @JsonInclude(JsonInclude.Include.NON_NULL) Integer precision,
        @JsonProperty("scale") @JsonInclude(JsonInclude.Include.NON_NULL) Integer scale,
        @JsonProperty("isPrimaryKey") boolean isPrimaryKey,
        @JsonProperty("isIdentity") boolean isIdentity,
        @JsonProperty("defaultValue") @JsonInclude(JsonInclude.Include.NON_EMPTY) String defaultValue
) {
    public static final String NULLABLE = "YES";
    public static final String NOT_NULLABLE = "NO";

    public Column {
        if (defaultValue == null) {
            defaultValue = "";
        }
    }

    public Column withPrimaryKey(boolean primaryKey) {
        if (primaryKey == isPrimaryKey) {
            return this;
        }
        return new Column(columnName, dataType, isNullable, maxLength, precision, scale,
                primaryKey, isIdentity, defaultValue);
    }
}
