package com.hoopsbot.ingest;

/**
 * The run snapshot could not be read or does not have the expected shape.
 */
public class SnapshotException extends Exception {
    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
