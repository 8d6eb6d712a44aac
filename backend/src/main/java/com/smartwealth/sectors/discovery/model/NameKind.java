package com.smartwealth.sectors.discovery.model;

public enum NameKind {
    SECTOR,
    SUBSECTOR
}
