package com.rambopet.clinic_backend.model;

import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class AppointmentTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 0);

    private Appointment booked() {
        return Appointment.builder()
                .scheduledAt(NOW.plusHours(2))
                .reason("Annual check-up")
                .build();
    }

    @Test
    void confirm_fromBooked_setsStatusAndTimestamp() {
        Appointment appointment = booked();

        appointment.confirm(NOW);

        assertEquals(AppointmentStatus.CONFIRMED, appointment.getStatus());
        assertEquals(NOW, appointment.getConfirmedAt());
    }

    @Test
    void confirm_twice_isRejectedWithoutChanges() {
        Appointment appointment = booked();
        appointment.confirm(NOW);

        assertThrows(InvalidStateTransitionException.class, () -> appointment.confirm(NOW.plusMinutes(5)));
        assertEquals(AppointmentStatus.CONFIRMED, appointment.getStatus());
        assertEquals(NOW, appointment.getConfirmedAt());
    }

    @Test
    void startThenComplete_stampsAttendance() {
        Appointment appointment = booked();

        appointment.start();
        appointment.complete(NOW.plusHours(3));

        assertEquals(AppointmentStatus.COMPLETED, appointment.getStatus());
        assertEquals(NOW.plusHours(3), appointment.getAttendedAt());
        assertTrue(appointment.getStatus().isTerminal());
    }

    @Test
    void complete_withoutStart_isRejected() {
        Appointment appointment = booked();

        assertThrows(InvalidStateTransitionException.class, () -> appointment.complete(NOW));
        assertEquals(AppointmentStatus.BOOKED, appointment.getStatus());
        assertNull(appointment.getAttendedAt());
    }

    @Test
    void cancel_recordsReason_andTerminalStatesRejectFurtherTransitions() {
        Appointment appointment = booked();

        appointment.cancel("Owner travelling", NOW);

        assertEquals(AppointmentStatus.CANCELLED, appointment.getStatus());
        assertEquals("Owner travelling", appointment.getCancellationReason());
        assertFalse(appointment.isCancellable());
        assertThrows(InvalidStateTransitionException.class, appointment::markNoShow);
        assertThrows(InvalidStateTransitionException.class, appointment::start);
    }

    @Test
    void estimatedEnd_addsDuration() {
        Appointment appointment = booked();
        appointment.setDurationMinutes(45);

        assertEquals(NOW.plusHours(2).plusMinutes(45), appointment.getEstimatedEnd());
    }

    @Test
    void overdue_onlyWhileNotTerminal() {
        Appointment appointment = booked();

        assertTrue(appointment.isOverdue(NOW.plusHours(3)));
        appointment.markNoShow();
        assertFalse(appointment.isOverdue(NOW.plusHours(3)));
    }
}
