package com.rambopet.clinic_backend.enums;

public enum ProductCategory {
    MEDICINE("Medicine"),
    VACCINE("Vaccine"),
    MEDICAL_SUPPLY("Medical supply"),
    FOOD("Food"),
    HYGIENE("Hygiene"),
    ACCESSORY("Accessory"),
    OTHER("Other");

    private final String displayName;

    ProductCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
