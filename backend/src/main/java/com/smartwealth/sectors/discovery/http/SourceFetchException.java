package com.smartwealth.sectors.discovery.http;

/**
 * Raised by the external source clients when a fetch cannot produce usable data.
 * The reason code is one of the {@link com.smartwealth.sectors.discovery.util.ReasonCodeClassifier} constants.
 */
public class SourceFetchException extends RuntimeException {
    private final String reasonCode;

    public SourceFetchException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public SourceFetchException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
