package com.smartwealth.sectors.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.smartwealth.sectors.discovery.source.SectorSourceCatalog;
import com.smartwealth.sectors.discovery.source.SectorSourceCatalogLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DiscoveryConfig {

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(DiscoveryProperties properties) {
        return Executors.newFixedThreadPool(properties.getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DiscoveryProperties properties) {
        int size = Math.max(4, properties.getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    // One producer and one consumer per open stream.
    @Bean(name = "streamExecutor", destroyMethod = "shutdown")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public SectorSourceCatalog sectorSourceCatalog(
        SectorSourceCatalogLoader loader,
        ResourceLoader resourceLoader,
        DiscoveryProperties properties
    ) {
        return loader.load(
            resourceLoader.getResource(properties.getCatalog().getSourcesLocation()),
            resourceLoader.getResource(properties.getCatalog().getCuratedTickersLocation())
        );
    }
}
