package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.BreedRequest;
import com.rambopet.clinic_backend.dto.request.SpeciesRequest;
import com.rambopet.clinic_backend.dto.response.BreedResponse;
import com.rambopet.clinic_backend.dto.response.SpeciesResponse;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Breed;
import com.rambopet.clinic_backend.model.Species;
import com.rambopet.clinic_backend.repository.BreedRepository;
import com.rambopet.clinic_backend.repository.SpeciesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Species and breed catalogue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpeciesService {

    private final SpeciesRepository speciesRepository;
    private final BreedRepository breedRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<SpeciesResponse> getAllSpecies(boolean activeOnly) {
        List<Species> species = activeOnly
                ? speciesRepository.findByActiveTrueOrderByNameAsc()
                : speciesRepository.findAllByOrderByNameAsc();
        return species.stream()
                .map(this::mapToSpeciesResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SpeciesResponse getSpeciesById(UUID id) {
        return mapToSpeciesResponse(findSpecies(id));
    }

    @Transactional
    public SpeciesResponse createSpecies(SpeciesRequest request) {
        if (speciesRepository.existsByNameIgnoreCase(request.getName().trim())) {
            throw ValidationException.of("species", "name", "Species already exists");
        }

        Species species = Species.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .active(request.getActive() != null ? request.getActive() : true)
                .build();

        Species saved = speciesRepository.save(species);
        log.info("Species created: {} ({})", saved.getName(), saved.getId());
        return mapToSpeciesResponse(saved);
    }

    @Transactional
    public SpeciesResponse updateSpecies(UUID id, SpeciesRequest request) {
        Species species = findSpecies(id);
        String name = request.getName().trim();
        if (!species.getName().equalsIgnoreCase(name) && speciesRepository.existsByNameIgnoreCase(name)) {
            throw ValidationException.of("species", "name", "Species already exists");
        }

        species.setName(name);
        species.setDescription(request.getDescription());
        if (request.getActive() != null) {
            species.setActive(request.getActive());
        }

        log.info("Species updated: {}", id);
        return mapToSpeciesResponse(speciesRepository.save(species));
    }

    @Transactional
    public void deactivateSpecies(UUID id) {
        Species species = findSpecies(id);
        species.setActive(false);
        speciesRepository.save(species);
        log.info("Species deactivated: {}", id);
    }

    @Transactional(readOnly = true)
    public List<BreedResponse> getBreedsForSpecies(UUID speciesId) {
        findSpecies(speciesId);
        return breedRepository.findBySpeciesIdAndActiveTrueOrderByNameAsc(speciesId)
                .stream()
                .map(this::mapToBreedResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<BreedResponse> getAllBreeds(UUID speciesId) {
        return breedRepository.findAllWithSpecies(speciesId)
                .stream()
                .map(this::mapToBreedResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public BreedResponse getBreedById(UUID id) {
        return mapToBreedResponse(findBreed(id));
    }

    @Transactional
    public BreedResponse createBreed(BreedRequest request) {
        Species species = findSpecies(request.getSpeciesId());
        String name = request.getName().trim();
        if (breedRepository.existsBySpeciesIdAndNameIgnoreCase(species.getId(), name)) {
            throw ValidationException.of("breed", "name", "Breed already exists for this species");
        }

        Breed breed = Breed.builder()
                .species(species)
                .name(name)
                .description(request.getDescription())
                .active(request.getActive() != null ? request.getActive() : true)
                .build();

        Breed saved = breedRepository.save(breed);
        log.info("Breed created: {} for species {}", saved.getName(), species.getName());
        return mapToBreedResponse(saved);
    }

    @Transactional
    public BreedResponse updateBreed(UUID id, BreedRequest request) {
        Breed breed = findBreed(id);
        Species species = findSpecies(request.getSpeciesId());
        String name = request.getName().trim();

        boolean identityChanged = !breed.getSpecies().getId().equals(species.getId())
                || !breed.getName().equalsIgnoreCase(name);
        if (identityChanged && breedRepository.existsBySpeciesIdAndNameIgnoreCase(species.getId(), name)) {
            throw ValidationException.of("breed", "name", "Breed already exists for this species");
        }

        breed.setSpecies(species);
        breed.setName(name);
        breed.setDescription(request.getDescription());
        if (request.getActive() != null) {
            breed.setActive(request.getActive());
        }

        log.info("Breed updated: {}", id);
        return mapToBreedResponse(breedRepository.save(breed));
    }

    @Transactional
    public void deactivateBreed(UUID id) {
        Breed breed = findBreed(id);
        breed.setActive(false);
        breedRepository.save(breed);
        log.info("Breed deactivated: {}", id);
    }

    public Species findSpecies(UUID id) {
        return speciesRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Species", "id", id));
    }

    public Breed findBreed(UUID id) {
        return breedRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Breed", "id", id));
    }

    public SpeciesResponse mapToSpeciesResponse(Species species) {
        return modelMapper.map(species, SpeciesResponse.class);
    }

    public BreedResponse mapToBreedResponse(Breed breed) {
        return BreedResponse.builder()
                .id(breed.getId())
                .speciesId(breed.getSpecies().getId())
                .speciesName(breed.getSpecies().getName())
                .name(breed.getName())
                .description(breed.getDescription())
                .active(breed.isActive())
                .createdAt(breed.getCreatedAt())
                .build();
    }
}
