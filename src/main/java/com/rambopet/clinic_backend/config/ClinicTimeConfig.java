package com.rambopet.clinic_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.TimeZone;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class ClinicTimeConfig {

    private final ClinicProperties clinicProperties;

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(ZoneId.of(clinicProperties.getTimeZone())));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }

    @Bean
    public ZoneId clinicZoneId() {
        return ZoneId.of(clinicProperties.getTimeZone());
    }

    @Bean
    public Clock clinicClock(ZoneId clinicZoneId) {
        return Clock.system(clinicZoneId);
    }
}
