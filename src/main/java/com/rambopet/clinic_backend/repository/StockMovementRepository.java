package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.enums.StockMovementType;
import com.rambopet.clinic_backend.model.StockMovement;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface StockMovementRepository extends JpaRepository<StockMovement, UUID> {

    @Query("SELECT sm FROM StockMovement sm JOIN sm.lot l WHERE " +
            "(:lotId IS NULL OR l.id = :lotId) AND " +
            "(:productId IS NULL OR l.product.id = :productId) AND " +
            "(:type IS NULL OR sm.type = :type) AND " +
            "(:from IS NULL OR sm.createdAt >= :from) AND " +
            "(:to IS NULL OR sm.createdAt <= :to)")
    Page<StockMovement> searchMovements(@Param("lotId") UUID lotId,
                                        @Param("productId") UUID productId,
                                        @Param("type") StockMovementType type,
                                        @Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to,
                                        Pageable pageable);

    @Query("SELECT sm FROM StockMovement sm WHERE sm.lot.product.id = :productId ORDER BY sm.createdAt DESC")
    List<StockMovement> findByProductId(@Param("productId") UUID productId, Pageable pageable);
}
