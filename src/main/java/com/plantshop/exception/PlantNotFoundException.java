package com.plantshop.exception;

import lombok.Getter;

@Getter
public class PlantNotFoundException extends RuntimeException {

    private final Long plantId;

    public PlantNotFoundException(Long plantId) {
        super("Plant not found with id: " + plantId);
        this.plantId = plantId;
    }
}
