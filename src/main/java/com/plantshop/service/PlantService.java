package com.plantshop.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantshop.dto.PlantDto;
import com.plantshop.entity.Plant;
import com.plantshop.exception.PlantNotFoundException;
import com.plantshop.exception.PlantStorageException;
import com.plantshop.exception.PlantValidationException;
import com.plantshop.repository.PlantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlantService {

    static final String NAME = "name";
    static final String IMAGE = "image";
    static final String PRICE = "price";
    static final String IN_STOCK = "is_in_stock";

    private final PlantRepository plantRepository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<PlantDto> listPlants() {
        return plantRepository.findAll().stream()
                .map(PlantDto::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PlantDto getPlant(Long id) {
        return new PlantDto(getPlantOrThrow(id));
    }

    /**
     * Creates a plant from a raw JSON body. {@code name}, {@code image} and {@code price}
     * are required, {@code is_in_stock} defaults to true.
     */
    @Transactional
    public PlantDto createPlant(String payload) {
        JsonNode root = readObject(payload);

        Plant plant = new Plant(
                readName(root, NAME),
                readName(root, IMAGE),
                readPrice(root),
                root.has(IN_STOCK) ? readInStock(root) : Boolean.TRUE);

        try {
            plant = plantRepository.saveAndFlush(plant);
        } catch (DataAccessException e) {
            throw new PlantStorageException("create", e);
        }
        log.info("Created plant {} ({})", plant.getId(), plant.getName());
        return new PlantDto(plant);
    }

    /**
     * Applies the fields present in a raw JSON body to an existing plant.
     * Only name, image, price and is_in_stock can change; the id and unknown keys are ignored.
     * The plant is looked up before the body is read, so a missing plant always wins over a bad body.
     */
    @Transactional
    public PlantDto updatePlant(Long id, String payload) {
        Plant plant = getPlantOrThrow(id);
        JsonNode root = readObject(payload);

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            String key = fields.next().getKey();
            switch (key) {
                case NAME -> plant.setName(readName(root, NAME));
                case IMAGE -> plant.setImage(readName(root, IMAGE));
                case PRICE -> plant.setPrice(readPrice(root));
                case IN_STOCK -> plant.setIsInStock(readInStock(root));
                default -> log.debug("Ignoring field '{}' in update of plant {}", key, id);
            }
        }

        try {
            plant = plantRepository.saveAndFlush(plant);
        } catch (DataAccessException e) {
            throw new PlantStorageException("update", e);
        }
        log.info("Updated plant {}", id);
        return new PlantDto(plant);
    }

    @Transactional
    public void deletePlant(Long id) {
        Plant plant = getPlantOrThrow(id);
        try {
            plantRepository.delete(plant);
            plantRepository.flush();
        } catch (DataAccessException e) {
            throw new PlantStorageException("delete", e);
        }
        log.info("Deleted plant {}", id);
    }

    private Plant getPlantOrThrow(Long id) {
        return plantRepository.findById(id)
                .orElseThrow(() -> new PlantNotFoundException(id));
    }

    private JsonNode readObject(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new PlantValidationException("Request body must be a JSON object");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new PlantValidationException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PlantValidationException("Request body must be a JSON object");
        }
        return root;
    }

    // Used for both name and image: a non-blank string
    private String readName(JsonNode root, String field) {
        JsonNode node = require(root, field);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new PlantValidationException("Field '" + field + "' must be a non-empty string");
        }
        return node.asText();
    }

    private Double readPrice(JsonNode root) {
        JsonNode node = require(root, PRICE);
        if (!node.isNumber()) {
            throw new PlantValidationException("Field '" + PRICE + "' must be a number");
        }
        double price = node.asDouble();
        if (!Double.isFinite(price)) {
            throw new PlantValidationException("Field '" + PRICE + "' is out of range");
        }
        if (price < 0) {
            throw new PlantValidationException("Field '" + PRICE + "' must not be negative");
        }
        return price;
    }

    private Boolean readInStock(JsonNode root) {
        JsonNode node = require(root, IN_STOCK);
        if (!node.isBoolean()) {
            throw new PlantValidationException("Field '" + IN_STOCK + "' must be a boolean");
        }
        return node.asBoolean();
    }

    private JsonNode require(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null) {
            throw new PlantValidationException("Missing required field: " + field);
        }
        if (node.isNull()) {
            throw new PlantValidationException("Field '" + field + "' must not be null");
        }
        return node;
    }
}
