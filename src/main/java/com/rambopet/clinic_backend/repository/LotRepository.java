package com.rambopet.clinic_backend.repository;

import com.rambopet.clinic_backend.model.Lot;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LotRepository extends JpaRepository<Lot, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Lot l WHERE l.id = :id")
    Optional<Lot> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByProductIdAndLotNumberIgnoreCase(UUID productId, String lotNumber);

    boolean existsByProductIdAndLotNumberIgnoreCaseAndIdNot(UUID productId, String lotNumber, UUID id);

    @Query("SELECT l FROM Lot l JOIN l.product p WHERE " +
            "(:productId IS NULL OR p.id = :productId) AND " +
            "(:active IS NULL OR l.active = :active) AND " +
            "(:expiresBefore IS NULL OR l.expiryDate <= :expiresBefore) AND " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(l.lotNumber) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')))")
    Page<Lot> searchLots(@Param("productId") UUID productId,
                         @Param("active") Boolean active,
                         @Param("expiresBefore") LocalDate expiresBefore,
                         @Param("search") String search,
                         Pageable pageable);

    @Query("SELECT l FROM Lot l WHERE l.active = true AND l.currentStock > 0 AND l.expiryDate < :today " +
            "ORDER BY l.expiryDate")
    List<Lot> findExpiredWithStock(@Param("today") LocalDate today);

    @Query("SELECT l FROM Lot l WHERE l.active = true AND l.currentStock > 0 " +
            "AND l.expiryDate >= :today AND l.expiryDate <= :limit ORDER BY l.expiryDate")
    List<Lot> findExpiringBetween(@Param("today") LocalDate today, @Param("limit") LocalDate limit);

    // Expired or expiring lots that have not been alerted on the given day yet
    @Query("SELECT l FROM Lot l JOIN FETCH l.product WHERE l.active = true AND l.currentStock > 0 " +
            "AND l.expiryDate <= :limit " +
            "AND (l.lastExpiryAlertDate IS NULL OR l.lastExpiryAlertDate <> :today) ORDER BY l.expiryDate")
    List<Lot> findPendingExpiryAlerts(@Param("today") LocalDate today, @Param("limit") LocalDate limit);

    @Query("SELECT COUNT(l) FROM Lot l WHERE l.active = true AND l.currentStock > 0 AND l.expiryDate < :today")
    long countExpiredWithStock(@Param("today") LocalDate today);
}
