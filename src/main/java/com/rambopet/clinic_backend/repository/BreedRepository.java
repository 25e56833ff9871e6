package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.Breed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BreedRepository extends JpaRepository<Breed, UUID> {
    boolean existsBySpeciesIdAndNameIgnoreCase(UUID speciesId, String name);

    List<Breed> findBySpeciesIdAndActiveTrueOrderByNameAsc(UUID speciesId);

    @Query("SELECT b FROM Breed b JOIN FETCH b.species s WHERE " +
            "(:speciesId IS NULL OR s.id = :speciesId) " +
            "ORDER BY s.name, b.name")
    List<Breed> findAllWithSpecies(@Param("speciesId") UUID speciesId);
}
