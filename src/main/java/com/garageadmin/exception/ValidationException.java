package com.garageadmin.exception;

/** Missing or malformed input that Bean Validation cannot express. Answered with 400. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
