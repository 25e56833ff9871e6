package com.rambopet.clinic_backend.enums;

public enum StockLevelStatus {
    OUT_OF_STOCK,
    LOW,
    NORMAL,
    OVERSTOCK;

    public static StockLevelStatus of(int totalStock, int minStock, int maxStock) {
        if (totalStock == 0) {
            return OUT_OF_STOCK;
        }
        if (totalStock < minStock) {
            return LOW;
        }
        if (totalStock > maxStock) {
            return OVERSTOCK;
        }
        return NORMAL;
    }
}
