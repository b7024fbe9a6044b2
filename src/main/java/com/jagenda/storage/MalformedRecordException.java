package com.jagenda.storage;

import java.io.IOException;

/**
 * Thrown when a record line cannot be parsed, or a record cannot be
 * represented in the line format.
 */
public class MalformedRecordException extends IOException {
    private final int lineNumber;

    public MalformedRecordException(String message) {
        this(message, -1);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    public MalformedRecordException(String message, int lineNumber) {
        super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    /**
     * @return 1-based line number of the offending line, or -1 when not read from input
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
