package com.plantshop.controller;

import com.plantshop.dto.PlantDto;
import com.plantshop.service.PlantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Bodies are read as raw strings so that a missing or malformed body is reported
 * by the service as a 400, after the plant lookup for PATCH.
 */
@RestController
@RequestMapping("/plants")
@RequiredArgsConstructor
@CrossOrigin(origins = "*") // Allow frontend access
public class PlantController {

    private final PlantService plantService;

    @GetMapping
    public List<PlantDto> getAllPlants() {
        return plantService.listPlants();
    }

    @PostMapping
    public ResponseEntity<PlantDto> createPlant(@RequestBody(required = false) String body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(plantService.createPlant(body));
    }

    @GetMapping("/{id}")
    public PlantDto getPlant(@PathVariable Long id) {
        return plantService.getPlant(id);
    }

    @PatchMapping("/{id}")
    public PlantDto updatePlant(@PathVariable Long id, @RequestBody(required = false) String body) {
        return plantService.updatePlant(id, body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePlant(@PathVariable Long id) {
        plantService.deletePlant(id);
        return ResponseEntity.noContent().build();
    }
}
