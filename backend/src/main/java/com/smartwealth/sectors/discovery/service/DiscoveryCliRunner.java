package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.DiscoveryResult;
import com.smartwealth.sectors.discovery.model.QuoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final DiscoveryProperties properties;
    private final CompanyDiscoveryService discoveryService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        DiscoveryProperties properties,
        CompanyDiscoveryService discoveryService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        DiscoveryRequest request = DiscoveryRequest.of(
            splitNames(properties.getCli().getSectors()),
            splitNames(properties.getCli().getSubsectors()),
            Math.max(1, Math.min(properties.getCli().getLimit(), properties.getApi().getMaxLimit())),
            false
        );

        int exitCode = 0;
        try {
            DiscoveryResult result = discoveryService.discover(request);
            log.info(
                "Discovery run {} returned {} companies (considered={}, rejected={}, enrichmentFailed={})",
                result.runId(),
                result.companies().size(),
                result.considered(),
                result.rejected(),
                result.enrichmentFailed()
            );
            for (AcceptedCompany company : result.companies()) {
                QuoteRecord record = company.record();
                log.info(
                    "Company {}: name={}, sector={}, industry={}, marketCap={}, price={}, source={}",
                    record.ticker(),
                    record.name(),
                    record.sector(),
                    record.industry(),
                    record.marketCap(),
                    record.price(),
                    company.candidate().source().label()
                );
            }
        } catch (IllegalArgumentException | CatastrophicDiscoveryException e) {
            log.warn("Discovery run failed: {}", e.getMessage());
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }

    static List<String> splitNames(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
