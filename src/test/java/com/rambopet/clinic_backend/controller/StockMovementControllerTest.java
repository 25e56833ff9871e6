package com.rambopet.clinic_backend.controller;

import com.rambopet.clinic_backend.config.JwtTokenProvider;
import com.rambopet.clinic_backend.config.SecurityConfig;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.enums.StockMovementType;
import com.rambopet.clinic_backend.exception.ForbiddenException;
import com.rambopet.clinic_backend.exception.InsufficientStockException;
import com.rambopet.clinic_backend.service.StockService;
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
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = StockMovementController.class)
@Import(SecurityConfig.class)
class StockMovementControllerTest {

    private static final String BODY = "{\"lotId\":\"6f1c2b8e-2f0a-4c55-9a61-3b1d2f0e9a10\",\"type\":\"SALE\",\"quantity\":3}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StockService stockService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private UserDetailsServiceImpl userDetailsService;

    @Test
    @WithMockUser(roles = "RECEPTIONIST")
    void outbound_returnsCreatedMovement() throws Exception {
        when(stockService.recordOutbound(any())).thenReturn(StockMovementResponse.builder()
                .id(UUID.randomUUID())
                .type(StockMovementType.SALE)
                .quantity(3)
                .stockBefore(10)
                .stockAfter(7)
                .build());

        mockMvc.perform(post("/api/inventory/movements/outbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.stockAfter").value(7));
    }

    @Test
    @WithMockUser(roles = "VETERINARIAN")
    void insufficientStock_isReportedAsFieldError() throws Exception {
        when(stockService.recordMovement(any())).thenThrow(new InsufficientStockException("L-1", 2, 3));

        mockMvc.perform(post("/api/inventory/movements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.errors.quantity").exists());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void delete_isForbiddenEvenForAdmin() throws Exception {
        doThrow(new ForbiddenException("Stock movements cannot be deleted"))
                .when(stockService).deleteMovement(any());

        mockMvc.perform(delete("/api/inventory/movements/{id}", UUID.randomUUID()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));
    }

    @Test
    @WithMockUser(roles = "GUARDIAN")
    void guardian_cannotReachInventory() throws Exception {
        mockMvc.perform(get("/api/inventory/movements"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(stockService);
    }

    @Test
    void anonymous_isUnauthorized() throws Exception {
        mockMvc.perform(get("/api/inventory/movements"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "RECEPTIONIST")
    void missingQuantity_failsValidation() throws Exception {
        mockMvc.perform(post("/api/inventory/movements/intake")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lotId\":\"6f1c2b8e-2f0a-4c55-9a61-3b1d2f0e9a10\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.quantity").value("Quantity is required"));

        verifyNoInteractions(stockService);
    }
}
