package com.plantshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlantShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlantShopApplication.class, args);
    }
}
