package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.config.JwtTokenProvider;
import com.rambopet.clinic_backend.config.SecurityConfig;
import com.rambopet.clinic_backend.dto.response.AppointmentResponse;
import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.exception.InvalidStateTransitionException;
import com.rambopet.clinic_backend.service.AppointmentService;
import com.rambopet.clinic_backend.service.UserDetailsServiceImpl;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AppointmentController.class)
@Import(SecurityConfig.class)
class AppointmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AppointmentService appointmentService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private UserDetailsServiceImpl userDetailsService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void delete_isAlwaysForbidden() throws Exception {
        mockMvc.perform(delete("/api/appointments/{id}", UUID.randomUUID()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Appointments cannot be deleted. Use the cancel action instead"));

        verifyNoInteractions(appointmentService);
    }

    @Test
    @WithMockUser(roles = "GUARDIAN")
    void guardian_canCancelWithReason() throws Exception {
        UUID id = UUID.randomUUID();
        when(appointmentService.cancel(id, "Travelling")).thenReturn(AppointmentResponse.builder()
                .id(id)
                .status(AppointmentStatus.CANCELLED)
                .build());

        mockMvc.perform(post("/api/appointments/{id}/cancel", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Travelling\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @WithMockUser(roles = "GUARDIAN")
    void guardian_cannotStartAppointment() throws Exception {
        mockMvc.perform(post("/api/appointments/{id}/start", UUID.randomUUID()))
                .andExpect(status().isForbidden());

        verify(appointmentService, never()).start(any());
    }

    @Test
    @WithMockUser(roles = "RECEPTIONIST")
    void invalidTransition_mapsToConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(appointmentService.confirm(eq(id)))
                .thenThrow(new InvalidStateTransitionException("appointment", AppointmentStatus.COMPLETED, "confirm"));

        mockMvc.perform(post("/api/appointments/{id}/confirm", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    @WithMockUser(roles = "RECEPTIONIST")
    void schedule_requiresDate() throws Exception {
        mockMvc.perform(get("/api/appointments/schedule"))
                .andExpect(status().isBadRequest());
    }
}
