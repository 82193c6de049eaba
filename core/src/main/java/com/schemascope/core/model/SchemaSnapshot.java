package com.schemascope.core.model;

import com.schemascope.core.BackendKind;

/**
 * Top-level result of one extraction run, relational or document.
 */
public interface SchemaSnapshot {
    String databaseName();

    BackendKind dbType();
}
