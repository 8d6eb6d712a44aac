package com.smartwealth.sectors.discovery.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One event of a discovery stream. On the wire the payload fields sit next to {@code status}.
 */
public record DiscoveryEvent(
    String status,
    Map<String, Object> payload
) {
    public static final String STARTED = "started";
    public static final String PROGRESS = "progress";
    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    public DiscoveryEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static DiscoveryEvent started(List<String> sectors, List<String> subsectors, int limit) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sectors", sectors);
        payload.put("subsectors", subsectors);
        payload.put("limit", limit);
        return new DiscoveryEvent(STARTED, payload);
    }

    public static DiscoveryEvent progress(CompanyView company, int index, int total) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("company", company);
        payload.put("index", index);
        payload.put("total", total);
        return new DiscoveryEvent(PROGRESS, payload);
    }

    public static DiscoveryEvent completed(DiscoveryResult result, List<CompanyView> companies) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("companies", companies);
        payload.put("total", companies.size());
        payload.put("considered", result.considered());
        payload.put("accepted", result.accepted());
        payload.put("rejected", result.rejected());
        payload.put("strategies", result.strategies());
        return new DiscoveryEvent(COMPLETED, payload);
    }

    public static DiscoveryEvent error(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message == null ? "discovery failed" : message);
        return new DiscoveryEvent(ERROR, payload);
    }

    public boolean isTerminal() {
        return COMPLETED.equals(status) || ERROR.equals(status);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("status", status);
        wire.putAll(payload);
        return wire;
    }
}
