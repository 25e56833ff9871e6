package com.rambopet.clinic_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "notifications")
@Data
public class NotificationProperties {
    private boolean enabled = true;
    private String appointmentReminderCron = "0 0 9 * * *";
    private String noShowSweepCron = "0 15 * * * *";
    private String vetScheduleCron = "0 0 7 * * *";
    private String lowStockCron = "0 0 8 * * *";
    private String expiryAlertCron = "0 0 10 * * MON";
    private String valuationReportCron = "0 0 7 1 * *";
    private int expiryWindowDays = 30;
    private int noShowGraceHours = 1;
}
