package com.smartwealth.sectors.discovery.model;

public record SubsectorEntry(String name, String sector) {
}
