package com.rambopet.clinic_backend.enums;

public enum Prognosis {
    EXCELLENT,
    GOOD,
    GUARDED,
    POOR
}
