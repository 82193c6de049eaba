package com.schemascope.cli;

/**
 * Opens one live, pinged connection for a run. The caller owns and closes it.
 */
@FunctionalInterface
public interface ConnectionFactory<C> {

    C open(ConnectionSettings settings) throws ConnectionException;
}
