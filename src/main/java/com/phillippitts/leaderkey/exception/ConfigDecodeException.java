package com.phillippitts.leaderkey.exception;

/**
 * Thrown when the config document is not valid JSON or does not describe a tree of
 * groups and actions. The file on disk is left untouched.
 */
public class ConfigDecodeException extends LeaderKeyException {

    private final String reason;

    public ConfigDecodeException(String reason) {
        super("Invalid config: " + reason);
        this.reason = reason;
    }

    public ConfigDecodeException(String reason, Throwable cause) {
        super("Invalid config: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
