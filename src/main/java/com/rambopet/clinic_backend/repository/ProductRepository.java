package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.model.Product;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {
    boolean existsByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCaseAndIdNot(String code, UUID id);

    @Query("SELECT p FROM Product p WHERE " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(p.code) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(p.activeIngredient) LIKE LOWER(CONCAT('%', :search, '%'))) AND " +
            "(:category IS NULL OR p.category = :category) AND " +
            "(:active IS NULL OR p.active = :active) AND " +
            "(:prescriptionRequired IS NULL OR p.prescriptionRequired = :prescriptionRequired)")
    Page<Product> searchProducts(@Param("search") String search,
                                 @Param("category") ProductCategory category,
                                 @Param("active") Boolean active,
                                 @Param("prescriptionRequired") Boolean prescriptionRequired,
                                 Pageable pageable);

    List<Product> findByActiveTrueOrderByNameAsc();

    @Query("SELECT p FROM Product p WHERE p.active = true AND " +
            "(SELECT COALESCE(SUM(l.currentStock), 0) FROM Lot l WHERE l.product = p AND l.active = true) < p.minStock " +
            "ORDER BY p.name")
    List<Product> findLowStockProducts();
}
