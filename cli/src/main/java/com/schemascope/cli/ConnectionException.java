package com.schemascope.cli;

/**
 * The database could not be reached, or did not answer a ping.
 */
public class ConnectionException extends Exception {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
