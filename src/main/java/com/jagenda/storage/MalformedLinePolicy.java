package com.jagenda.storage;

/**
 * What to do with a line of a record file that cannot be parsed.
 */
public enum MalformedLinePolicy {
    /** Reject the whole input; nothing is applied. */
    FAIL,
    /** Log the line and continue with the next one. */
    SKIP
}
