package com.plantshop.exception;

import org.springframework.dao.DataAccessException;

/**
 * The database refused or failed a write (constraint violation, lost connection, ...).
 */
public class PlantStorageException extends RuntimeException {

    public PlantStorageException(String operation, DataAccessException cause) {
        super("Failed to " + operation + " plant: " + describe(cause), cause);
    }

    private static String describe(DataAccessException e) {
        Throwable root = e.getMostSpecificCause();
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
