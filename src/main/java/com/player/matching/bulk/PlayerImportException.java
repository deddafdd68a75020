package com.player.matching.bulk;

/**
 * Runtime exception thrown when a player file cannot be loaded at all,
 * e.g. it is empty, lacks required columns or cannot be read.
 */
public class PlayerImportException extends RuntimeException {

    public PlayerImportException(String message) {
        super(message);
    }

    public PlayerImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
