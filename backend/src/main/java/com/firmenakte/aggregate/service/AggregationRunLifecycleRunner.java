package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.AggregationRunView;
import com.firmenakte.aggregate.persistence.CompanyRecordRepository;
import com.firmenakte.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class AggregationRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AggregationRunLifecycleRunner.class);

    private final CompanyRecordRepository repository;
    private final AggregatorProperties properties;

    public AggregationRunLifecycleRunner(CompanyRecordRepository repository, AggregatorProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping aggregation run cleanup because database is unreachable");
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getRun().getStaleRunMinutes()));
        List<AggregationRunView> running = repository.findRunningAggregationRuns();
        for (AggregationRunView run : running) {
            if (run.startedAt() != null && run.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.completeAggregationRun(
                run.runId(),
                Instant.now(),
                CompanyRecordRepository.RUN_ABORTED,
                null,
                "aborted_on_startup"
            );
            log.info("Aborted stale aggregation run {} startedAt={}", run.runId(), run.startedAt());
        }
    }
}
