package com.plantshop.dto;

/**
 * Body of a 404 response: {@code {"error": "Plant not found"}}.
 */
public record ErrorResponse(String error) {

    private static final String PLANT_NOT_FOUND = "Plant not found";

    public static ErrorResponse plantNotFound() {
        return new ErrorResponse(PLANT_NOT_FOUND);
    }
}
