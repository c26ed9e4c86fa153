package com.plantshop.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

@Entity
@Table(name = "plants")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Plant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // URL or relative path of the picture shown by the storefront
    @Column(nullable = false)
    private String image;

    @Column(nullable = false)
    private Double price;

    @Column(name = "is_in_stock", nullable = false)
    private Boolean isInStock = true;

    public Plant(String name, String image, Double price, Boolean isInStock) {
        this.name = name;
        this.image = image;
        this.price = price;
        this.isInStock = isInStock;
    }
}
