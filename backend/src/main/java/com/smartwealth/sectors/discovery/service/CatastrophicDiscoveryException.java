package com.smartwealth.sectors.discovery.service;

public class CatastrophicDiscoveryException extends RuntimeException {
    public CatastrophicDiscoveryException(String message) {
        super(message);
    }

    public CatastrophicDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
