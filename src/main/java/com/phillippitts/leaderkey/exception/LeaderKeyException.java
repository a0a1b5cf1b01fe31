package com.phillippitts.leaderkey.exception;

/**
 * Base exception for config tree errors: decoding the document and reading or writing
 * the file. Unchecked, so store operations can surface them through futures and events.
 */
public class LeaderKeyException extends RuntimeException {

    public LeaderKeyException(String message) {
        super(message);
    }

    public LeaderKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
