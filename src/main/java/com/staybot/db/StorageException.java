package com.staybot.db;

/**
 * Storage I/O or SQL failure. Fatal to the current pass, not to the process.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
