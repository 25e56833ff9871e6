package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.StockLevelStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LotTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    @Test
    void expiryFlags() {
        Lot expired = Lot.builder().expiryDate(TODAY.minusDays(1)).build();
        Lot soon = Lot.builder().expiryDate(TODAY.plusDays(30)).build();
        Lot later = Lot.builder().expiryDate(TODAY.plusDays(31)).build();

        assertTrue(expired.isExpired(TODAY));
        assertFalse(expired.isExpiringSoon(TODAY));
        assertTrue(soon.isExpiringSoon(TODAY));
        assertEquals(30, soon.daysToExpiry(TODAY));
        assertFalse(later.isExpiringSoon(TODAY));
    }

    @Test
    void productTotalStock_countsActiveLotsOnly() {
        Product product = Product.builder().code("AMX-250").name("Amoxicillin").minStock(10).maxStock(100)
                .lots(new ArrayList<>()).build();
        product.getLots().addAll(List.of(
                Lot.builder().product(product).currentStock(4).active(true).build(),
                Lot.builder().product(product).currentStock(50).active(false).build()));

        assertEquals(4, product.getTotalStock());
        assertTrue(product.isLowStock());
        assertEquals(StockLevelStatus.LOW, product.getStockLevelStatus());
        assertEquals(1, product.getActiveLotCount());
    }
}
