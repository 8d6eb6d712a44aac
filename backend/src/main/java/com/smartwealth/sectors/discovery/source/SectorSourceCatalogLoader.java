package com.smartwealth.sectors.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartwealth.sectors.discovery.model.IndustryKeyword;
import com.smartwealth.sectors.discovery.model.SectorTaxonomyEntry;
import com.smartwealth.sectors.discovery.model.SubsectorEntry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SectorSourceCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(SectorSourceCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public SectorSourceCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SectorSourceCatalog load(Resource sources, Resource curatedTickers) {
        JsonNode root;
        try (InputStream in = sources.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read sector source catalog " + sources.getDescription(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Sector source catalog is not a JSON object");
        }
        String version = text(root.path("version"));
        if (version == null) {
            throw new IllegalStateException("Sector source catalog is missing a version");
        }

        List<SectorTaxonomyEntry> sectors = new ArrayList<>();
        for (JsonNode node : root.path("sectors")) {
            String name = text(node.path("name"));
            if (name == null) {
                throw new IllegalStateException("Sector entry without a name in catalog " + version);
            }
            sectors.add(new SectorTaxonomyEntry(name, strings(node.path("screenerIds")), strings(node.path("fallbackTickers"))));
        }

        List<SubsectorEntry> subsectors = new ArrayList<>();
        for (JsonNode node : root.path("subsectors")) {
            subsectors.add(new SubsectorEntry(text(node.path("name")), text(node.path("sector"))));
        }

        List<IndustryKeyword> keywords = new ArrayList<>();
        for (JsonNode node : root.path("industryKeywords")) {
            keywords.add(new IndustryKeyword(text(node.path("keyword")), text(node.path("sector"))));
        }

        List<List<String>> synonymGroups = new ArrayList<>();
        for (JsonNode group : root.path("synonymGroups")) {
            synonymGroups.add(strings(group));
        }

        SectorSourceCatalog catalog = new SectorSourceCatalog(
            version,
            text(root.path("screenerBaseUrl")),
            sectors,
            subsectors,
            keywords,
            strings(root.path("catchAllSectors")),
            synonymGroups,
            strings(root.path("secondaryProviders")),
            readCuratedTables(curatedTickers)
        );
        log.info("Loaded sector source catalog version={} sectors={} subsectors={} keywords={} curatedProviders={}",
            version, sectors.size(), subsectors.size(), keywords.size(), catalog.curatedTables().size());
        return catalog;
    }

    private Map<String, Map<String, List<String>>> readCuratedTables(Resource curatedTickers) {
        Map<String, Map<String, List<String>>> tables = new LinkedHashMap<>();
        if (curatedTickers == null || !curatedTickers.exists()) {
            log.warn("Curated ticker tables not found, continuing without them");
            return tables;
        }
        try (Reader reader = new InputStreamReader(curatedTickers.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String provider = blankToNull(record.get("provider"));
                String key = blankToNull(record.get("key"));
                String tickers = blankToNull(record.get("tickers"));
                if (provider == null || key == null || tickers == null) {
                    log.warn("Skipping curated tickers row {} with missing fields", record.getRecordNumber());
                    continue;
                }
                tables.computeIfAbsent(provider, ignored -> new LinkedHashMap<>())
                    .put(SectorSourceCatalog.key(key), List.of(tickers.trim().split("\\s+")));
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Unable to read curated ticker tables " + curatedTickers.getDescription(), e);
        }
        return tables;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            String value = text(node);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return blankToNull(node.asText());
    }

    private String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
