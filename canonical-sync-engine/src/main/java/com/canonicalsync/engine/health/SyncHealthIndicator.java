package com.canonicalsync.engine.health;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.repository.SyncJobRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the sync engine.
 * Reports health status based on:
 * - Database connectivity
 * - Sync job counts by status
 * - Jobs that have not made progress within the liveness timeout
 */
@Component
public class SyncHealthIndicator implements HealthIndicator {

    private static final int STALE_JOB_WARNING_THRESHOLD = 5;

    private final JdbcTemplate jdbcTemplate;
    private final SyncJobRepository jobRepository;
    private final Clock clock;
    private final Duration livenessTimeout;

    public SyncHealthIndicator(
            JdbcTemplate jdbcTemplate,
            SyncJobRepository jobRepository,
            Clock clock,
            @Value("${sync.recovery.liveness-timeout:30m}") Duration livenessTimeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.livenessTimeout = livenessTimeout;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkDatabase(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkJobHealth(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            boolean healthy = result != null && result == 1;
            details.put("database", healthy ? "connected" : "unexpected response");
            return healthy;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkJobHealth(Map<String, Object> details) {
        try {
            Map<String, Integer> jobCounts = new HashMap<>();
            jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM sync_jobs GROUP BY status", rs -> {
                jobCounts.put(rs.getString("status"), rs.getInt("count"));
            });
            details.put("syncJobs", jobCounts);

            List<SyncJob> stale = jobRepository.findStale(
                clock.instant().minus(livenessTimeout), STALE_JOB_WARNING_THRESHOLD + 1);
            details.put("staleJobs", stale.size());
            if (stale.size() > STALE_JOB_WARNING_THRESHOLD) {
                details.put("staleJobWarning", "Many jobs exceeded the liveness timeout - recovery may be disabled");
            }
        } catch (Exception e) {
            details.put("jobHealthError", e.getMessage());
        }
    }
}
