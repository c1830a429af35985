package com.testall.core.engine;

/**
 * The run could not be carried out at all (as opposed to a test failing).
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
