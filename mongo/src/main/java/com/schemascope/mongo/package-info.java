/**
 * MongoDB side of schema extraction.
 *
 * Lists the collections of one database and reports them as
 * {@link com.schemascope.core.model.DocumentCollection} records. Index and sample-document
 * extraction is not implemented; those fields are always empty.
 */
package com.schemascope.mongo;
