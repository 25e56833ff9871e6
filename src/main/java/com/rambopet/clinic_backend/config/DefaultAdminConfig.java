package com.rambopet.clinic_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "admin.default")
@Data
public class DefaultAdminConfig {
    private String email = "admin@rambopet.local";
    private String username = "admin";
    private String password;
    private String firstName = "System";
    private String lastName = "Administrator";
    private String phone;
    private boolean enabled = true;
}
