package com.example.prismquest.engine;

/**
 * Thrown when an action payload has a field of the wrong type or an unknown value.
 * {@link GameEngine} turns it into a failure result.
 */
public class InvalidActionException extends RuntimeException {

    public InvalidActionException(String message) {
        super(message);
    }
}
