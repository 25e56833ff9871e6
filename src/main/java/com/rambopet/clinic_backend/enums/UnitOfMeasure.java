package com.rambopet.clinic_backend.enums;

public enum UnitOfMeasure {
    UNIT,
    BOX,
    BOTTLE,
    AMPOULE,
    TABLET,
    CAPSULE,
    ML,
    GRAM,
    KILOGRAM
}
