package com.plantshop.exception;

/**
 * The request body could not be turned into a valid plant: malformed JSON,
 * a missing required field, a value of the wrong type or out of range.
 */
public class PlantValidationException extends RuntimeException {

    public PlantValidationException(String message) {
        super(message);
    }

    public PlantValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
