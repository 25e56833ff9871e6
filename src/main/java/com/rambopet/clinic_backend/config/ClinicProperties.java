package com.rambopet.clinic_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "clinic")
@Data
public class ClinicProperties {
    private String name = "RamboPet";
    private String timeZone = "America/Mexico_City";
    private String uploadDir = "uploads";
}
