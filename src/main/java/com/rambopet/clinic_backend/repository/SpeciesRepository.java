package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.Species;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SpeciesRepository extends JpaRepository<Species, UUID> {
    boolean existsByNameIgnoreCase(String name);

    List<Species> findAllByOrderByNameAsc();

    List<Species> findByActiveTrueOrderByNameAsc();
}
