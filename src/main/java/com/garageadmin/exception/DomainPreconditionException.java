package com.garageadmin.exception;

/**
 * The request is well-formed but the workflow forbids it right now,
 * e.g. a vehicle leaving with unfinished services. Answered with 400.
 */
public class DomainPreconditionException extends RuntimeException {

    public DomainPreconditionException(String message) {
        super(message);
    }
}
