package com.rambopet.clinic_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of one run of a notification job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunSummary {
    private String job;
    private LocalDateTime startedAt;
    // Items the job looked at (appointments, products, lots)
    private int candidates;
    private int processed;
    private int emailsSent;
    private int failures;

    public static JobRunSummary start(String job, LocalDateTime now) {
        return JobRunSummary.builder().job(job).startedAt(now).build();
    }

    public void incrementProcessed() {
        processed++;
    }

    public void incrementEmailsSent() {
        emailsSent++;
    }

    public void incrementFailures() {
        failures++;
    }
}
