package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.AggregationResult;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.SourceReport;
import com.firmenakte.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AggregationCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AggregationCliRunner.class);

    private final AggregatorProperties properties;
    private final CompanyAggregationService aggregationService;
    private final ConfigurableApplicationContext applicationContext;

    public AggregationCliRunner(
        AggregatorProperties properties,
        CompanyAggregationService aggregationService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.aggregationService = aggregationService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CompanyIdentity identity = new CompanyIdentity(
            properties.getCli().getCompanyName(),
            properties.getCli().getRegisternummer(),
            properties.getCli().getUstIdnr()
        );

        int exitCode = 0;
        try {
            AggregationResult result = aggregationService.aggregate(identity);
            log.info(
                "Aggregation run {} completed: {} fields, persisted={}",
                result.report().runId(),
                result.record().fields().size(),
                result.persisted()
            );
            for (Map.Entry<SourceId, SourceReport> entry : result.report().sources().entrySet()) {
                SourceReport source = entry.getValue();
                log.info(
                    "Summary {}: status={}, attempts={}, fields={}, failure={}, detail={}",
                    entry.getKey().key(),
                    source.status(),
                    source.attemptCount(),
                    source.fieldsContributed().size(),
                    source.failureKind(),
                    source.detail()
                );
            }
            if (!result.persisted()) {
                exitCode = 2;
            }
        } catch (InvalidIdentityException e) {
            log.error("Cannot aggregate: {}", e.getMessage());
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }
}
