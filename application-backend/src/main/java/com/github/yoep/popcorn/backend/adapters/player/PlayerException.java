package com.github.yoep.popcorn.backend.adapters.player;

/**
 * Defines the base exception for all player exceptions.
 */
public class PlayerException extends RuntimeException {
    public PlayerException(String message) {
        super(message);
    }

    public PlayerException(String message, Throwable cause) {
        super(message, cause);
    }
}
