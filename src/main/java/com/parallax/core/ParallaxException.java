package com.parallax.core;

/**
 * Base class for errors raised by the task-distribution engine.
 */
public class ParallaxException extends RuntimeException {

    public ParallaxException(String message) {
        super(message);
    }

    public ParallaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
