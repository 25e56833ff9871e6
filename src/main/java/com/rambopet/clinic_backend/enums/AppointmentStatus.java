package com.rambopet.clinic_backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum AppointmentStatus {
    BOOKED,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    /** States from which an appointment can still be cancelled, started or marked as a no-show. */
    public static final Set<AppointmentStatus> PENDING = EnumSet.of(BOOKED, CONFIRMED);

    public static final Set<AppointmentStatus> INACTIVE = EnumSet.of(CANCELLED, NO_SHOW);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
    }
}
