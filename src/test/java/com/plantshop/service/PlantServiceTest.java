package com.plantshop.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantshop.dto.PlantDto;
import com.plantshop.entity.Plant;
import com.plantshop.exception.PlantNotFoundException;
import com.plantshop.exception.PlantStorageException;
import com.plantshop.exception.PlantValidationException;
import com.plantshop.repository.PlantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlantServiceTest {

    @Mock
    private PlantRepository plantRepository;

    private PlantService plantService;

    @BeforeEach
    void setUp() {
        plantService = new PlantService(plantRepository, new ObjectMapper());
    }

    @Test
    void listMapsEveryPlantInStoreOrder() {
        when(plantRepository.findAll()).thenReturn(List.of(
                new Plant(2L, "Fern", "fern.jpg", 9.5, false),
                new Plant(1L, "Aloe", "aloe.jpg", 15.0, true)));

        List<PlantDto> plants = plantService.listPlants();

        assertThat(plants).extracting(PlantDto::getId).containsExactly(2L, 1L);
        assertThat(plants.get(0).getIsInStock()).isFalse();
    }

    @Test
    void createDefaultsInStockToTrue() {
        when(plantRepository.saveAndFlush(any(Plant.class))).thenAnswer(invocation -> {
            Plant plant = invocation.getArgument(0);
            plant.setId(7L);
            return plant;
        });

        PlantDto created = plantService.createPlant("{\"name\":\"Aloe\",\"image\":\"aloe.jpg\",\"price\":15}");

        assertThat(created).isEqualTo(new PlantDto(7L, "Aloe", "aloe.jpg", 15.0, true));
    }

    @Test
    void createRejectsStringPrice() {
        assertThatThrownBy(() -> plantService.createPlant("{\"name\":\"Aloe\",\"image\":\"aloe.jpg\",\"price\":\"15\"}"))
                .isInstanceOf(PlantValidationException.class)
                .hasMessage("Field 'price' must be a number");
        verify(plantRepository, never()).saveAndFlush(any());
    }

    @Test
    void createRejectsPriceOutsideDoubleRange() {
        assertThatThrownBy(() -> plantService.createPlant("{\"name\":\"Aloe\",\"image\":\"aloe.jpg\",\"price\":1e400}"))
                .isInstanceOf(PlantValidationException.class)
                .hasMessage("Field 'price' is out of range");
        verify(plantRepository, never()).saveAndFlush(any());
    }

    @Test
    void createRejectsBlankImageAndNullName() {
        assertThatThrownBy(() -> plantService.createPlant("{\"name\":\"Aloe\",\"image\":\"  \",\"price\":1}"))
                .isInstanceOf(PlantValidationException.class)
                .hasMessageContaining("image");
        assertThatThrownBy(() -> plantService.createPlant("{\"name\":null,\"image\":\"a.jpg\",\"price\":1}"))
                .isInstanceOf(PlantValidationException.class)
                .hasMessage("Field 'name' must not be null");
    }

    @Test
    void createMapsStorageFailures() {
        when(plantRepository.saveAndFlush(any(Plant.class)))
                .thenThrow(new DataIntegrityViolationException("NULL not allowed for column \"NAME\""));

        assertThatThrownBy(() -> plantService.createPlant("{\"name\":\"Aloe\",\"image\":\"aloe.jpg\",\"price\":15}"))
                .isInstanceOf(PlantStorageException.class)
                .hasMessageContaining("Failed to create plant")
                .hasMessageContaining("NULL not allowed");
    }

    @Test
    void updateAppliesOnlyAllowListedFields() {
        Plant plant = new Plant(3L, "Aloe", "aloe.jpg", 15.0, true);
        when(plantRepository.findById(3L)).thenReturn(Optional.of(plant));
        when(plantRepository.saveAndFlush(plant)).thenReturn(plant);

        PlantDto updated = plantService.updatePlant(3L,
                "{\"id\":99,\"name\":\"Aloe Vera\",\"price\":12.5,\"is_in_stock\":false,\"color\":\"green\"}");

        assertThat(updated).isEqualTo(new PlantDto(3L, "Aloe Vera", "aloe.jpg", 12.5, false));
        ArgumentCaptor<Plant> saved = ArgumentCaptor.forClass(Plant.class);
        verify(plantRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(3L);
    }

    @Test
    void updateChecksExistenceBeforeReadingBody() {
        when(plantRepository.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> plantService.updatePlant(42L, "{broken"))
                .isInstanceOf(PlantNotFoundException.class);
    }

    @Test
    void updateRejectsNonObjectBody() {
        when(plantRepository.findById(3L)).thenReturn(Optional.of(new Plant(3L, "Aloe", "aloe.jpg", 15.0, true)));

        assertThatThrownBy(() -> plantService.updatePlant(3L, "\"is_in_stock\""))
                .isInstanceOf(PlantValidationException.class)
                .hasMessage("Request body must be a JSON object");
        verify(plantRepository, never()).saveAndFlush(any());
    }

    @Test
    void deleteRemovesExistingPlant() {
        Plant plant = new Plant(5L, "Cactus", "cactus.jpg", 7.0, true);
        when(plantRepository.findById(5L)).thenReturn(Optional.of(plant));

        plantService.deletePlant(5L);

        verify(plantRepository).delete(plant);
        verify(plantRepository).flush();
    }

    @Test
    void deleteOfMissingPlantThrowsNotFound() {
        when(plantRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> plantService.deletePlant(5L))
                .isInstanceOf(PlantNotFoundException.class)
                .hasMessage("Plant not found with id: 5")
                .hasFieldOrPropertyWithValue("plantId", 5L);
        verify(plantRepository, never()).delete(any());
    }
}
