package com.hoopsbot.identity;

/**
 * Raised when a player name cannot be turned into a comparison key.
 * Fatal to the one record carrying the name, never to the run.
 */
public final class InvalidNameException extends IllegalArgumentException {

    public InvalidNameException(String message) {
        super(message);
    }
}
