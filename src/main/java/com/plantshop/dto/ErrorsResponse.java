package com.plantshop.dto;

import java.util.List;

/**
 * Body of a 400 response: {@code {"errors": ["..."]}}.
 */
public record ErrorsResponse(List<String> errors) {

    public static ErrorsResponse of(String message) {
        return new ErrorsResponse(List.of(message));
    }
}
