package com.rambopet.clinic_backend.enums;

public enum AppointmentType {
    GENERAL_CONSULTATION("General consultation"),
    VACCINATION("Vaccination"),
    SURGERY("Surgery"),
    EMERGENCY("Emergency"),
    FOLLOW_UP("Follow-up"),
    DEWORMING("Deworming"),
    OTHER("Other");

    private final String displayName;

    AppointmentType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
