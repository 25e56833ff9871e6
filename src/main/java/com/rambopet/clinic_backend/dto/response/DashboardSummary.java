package com.rambopet.clinic_backend.dto.response;

import com.rambopet.clinic_backend.enums.AppointmentStatus;
import com.rambopet.clinic_backend.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {
    private LocalDate date;
    private Map<Role, Long> activeUsersByRole;
    private long activePatients;
    private Map<AppointmentStatus, Long> todayAppointmentsByStatus;
    private long openEpisodes;
    private long lowStockProducts;
    private long expiredLots;
}
