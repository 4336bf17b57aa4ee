package com.staybot.notify;

/**
 * Outbound notification failed. Logged and recorded; not retried within the pass.
 */
public class NotifyException extends Exception {

    public NotifyException(String message) {
        super(message);
    }

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
