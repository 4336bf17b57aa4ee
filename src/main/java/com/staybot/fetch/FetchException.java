package com.staybot.fetch;

/**
 * One source could not be queried. The pass skips that source and carries on.
 */
public class FetchException extends Exception {
    private final String source;

    public FetchException(String source, String message) {
        super(message);
        this.source = source;
    }

    public FetchException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
