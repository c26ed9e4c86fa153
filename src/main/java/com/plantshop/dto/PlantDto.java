package com.plantshop.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.plantshop.entity.Plant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat JSON shape of a plant as returned by every endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "name", "image", "price", "is_in_stock"})
public class PlantDto {
    private Long id;
    private String name;
    private String image;
    private Double price;

    @JsonProperty("is_in_stock")
    private Boolean isInStock;

    public PlantDto(Plant plant) {
        this.setId(plant.getId());
        this.setName(plant.getName());
        this.setImage(plant.getImage());
        this.setPrice(plant.getPrice());
        this.setIsInStock(plant.getIsInStock());
    }
}
