package com.smartwealth.sectors.discovery.util;

import com.smartwealth.sectors.discovery.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReasonCodeClassifierTest {

    @Test
    void mapsStatusCodes() {
        assertThat(ReasonCodeClassifier.fromHttpStatus(403)).isEqualTo(ReasonCodeClassifier.HTTP_401_403);
        assertThat(ReasonCodeClassifier.fromHttpStatus(404)).isEqualTo(ReasonCodeClassifier.HTTP_404);
        assertThat(ReasonCodeClassifier.fromHttpStatus(429)).isEqualTo(ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
        assertThat(ReasonCodeClassifier.fromHttpStatus(503)).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
        assertThat(ReasonCodeClassifier.fromHttpStatus(null)).isEqualTo(ReasonCodeClassifier.UNKNOWN);
    }

    @Test
    void transportErrorsWinOverStatus() {
        HttpFetchResult dnsFailure = new HttpFetchResult(
            "https://nowhere.invalid/", null, 0, null, null, Instant.now(), Duration.ZERO,
            "io_error", "java.net.UnknownHostException: nowhere.invalid"
        );
        assertThat(ReasonCodeClassifier.fromFetchResult(dnsFailure)).isEqualTo(ReasonCodeClassifier.DNS_FAILURE);
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.DNS_FAILURE)).isTrue();
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.EMPTY_RESULT)).isFalse();
    }
}
