package com.rambopet.clinic_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum Role {
    GUARDIAN,
    VETERINARIAN,
    RECEPTIONIST,
    ADMIN;

    public static final Set<Role> STAFF = EnumSet.of(VETERINARIAN, RECEPTIONIST, ADMIN);

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }

    public boolean isStaff() {
        return STAFF.contains(this);
    }
}
