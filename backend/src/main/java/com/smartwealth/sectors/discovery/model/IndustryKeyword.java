package com.smartwealth.sectors.discovery.model;

public record IndustryKeyword(String keyword, String sector) {
}
