package com.smartwealth.sectors.discovery.stream;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.DiscoveryEvent;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.DiscoveryResult;
import com.smartwealth.sectors.discovery.model.QuoteRecord;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import com.smartwealth.sectors.discovery.service.CatastrophicDiscoveryException;
import com.smartwealth.sectors.discovery.service.CompanyDiscoveryService;
import com.smartwealth.sectors.discovery.service.DiscoveryListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryStreamServiceTest {
    private static final DiscoveryRequest REQUEST = DiscoveryRequest.of(List.of("Technology"), List.of(), 3, true);

    @Mock
    private CompanyDiscoveryService discoveryService;

    private ExecutorService executor;
    private DiscoveryStreamService streamService;

    @BeforeEach
    void setUp() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getStream().setChannelCapacity(1);
        properties.getStream().setTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(2);
        streamService = new DiscoveryStreamService(discoveryService, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emitsStartedProgressAndSingleCompletedLast() throws Exception {
        AcceptedCompany aapl = company("AAPL", 0, 3_000L);
        AcceptedCompany msft = company("MSFT", 1, 3_100L);
        when(discoveryService.discover(eq(REQUEST), any(DiscoveryListener.class))).thenAnswer(invocation -> {
            DiscoveryListener listener = invocation.getArgument(1);
            listener.onAccepted(aapl, 1);
            listener.onAccepted(msft, 2);
            return result(List.of(msft, aapl));
        });
        RecordingSink sink = new RecordingSink(false);

        streamService.stream(REQUEST, sink).get(5, TimeUnit.SECONDS);

        assertThat(sink.events).extracting(DiscoveryEvent::status).containsExactly("started", "progress", "progress", "completed");
        Map<String, Object> firstProgress = sink.events.get(1).toMap();
        assertThat(firstProgress).containsEntry("index", 1).containsEntry("total", 3);
        Map<String, Object> completed = sink.events.get(3).toMap();
        assertThat(completed).containsEntry("total", 2).containsEntry("considered", 4).containsEntry("rejected", 1);
        assertThat(sink.completions.get()).isEqualTo(1);
    }

    @Test
    void catastrophicFailureEndsWithErrorEvent() throws Exception {
        when(discoveryService.discover(eq(REQUEST), any(DiscoveryListener.class)))
            .thenThrow(new CatastrophicDiscoveryException("no candidate tickers available"));
        RecordingSink sink = new RecordingSink(false);

        streamService.stream(REQUEST, sink).get(5, TimeUnit.SECONDS);

        assertThat(sink.events).extracting(DiscoveryEvent::status).containsExactly("started", "error");
        assertThat(sink.events.get(1).toMap()).containsEntry("error", "no candidate tickers available");
        assertThat(sink.completions.get()).isEqualTo(1);
    }

    @Test
    void zeroAcceptedStillCompletes() throws Exception {
        when(discoveryService.discover(eq(REQUEST), any(DiscoveryListener.class))).thenReturn(result(List.of()));
        RecordingSink sink = new RecordingSink(false);

        streamService.stream(REQUEST, sink).get(5, TimeUnit.SECONDS);

        assertThat(sink.events).extracting(DiscoveryEvent::status).containsExactly("started", "completed");
        assertThat(sink.events.get(1).toMap()).containsEntry("total", 0);
    }

    @Test
    void disconnectedClientDoesNotStopProducer() throws Exception {
        when(discoveryService.discover(eq(REQUEST), any(DiscoveryListener.class))).thenAnswer(invocation -> {
            DiscoveryListener listener = invocation.getArgument(1);
            for (int i = 1; i <= 3; i++) {
                listener.onAccepted(company("T" + i, i, 100L * i), i);
            }
            return result(List.of());
        });
        RecordingSink sink = new RecordingSink(true);

        streamService.stream(REQUEST, sink).get(5, TimeUnit.SECONDS);

        verify(discoveryService).discover(eq(REQUEST), any(DiscoveryListener.class));
        assertThat(sink.attempts.get()).isEqualTo(1);
        assertThat(sink.completions.get()).isZero();
    }

    @Test
    void stalledProducerEndsWithSingleTimeoutError() throws Exception {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getStream().setChannelCapacity(1);
        properties.getStream().setTimeoutSeconds(1);
        DiscoveryStreamService shortTimeout = new DiscoveryStreamService(discoveryService, properties, executor);
        CountDownLatch release = new CountDownLatch(1);
        when(discoveryService.discover(eq(REQUEST), any(DiscoveryListener.class))).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            DiscoveryListener listener = invocation.getArgument(1);
            listener.onAccepted(company("AAPL", 0, 3_000L), 1);
            return result(List.of());
        });
        RecordingSink sink = new RecordingSink(false);

        try {
            shortTimeout.stream(REQUEST, sink).get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
        }

        assertThat(sink.events).extracting(DiscoveryEvent::status).containsExactly("started", "error");
        assertThat(sink.events.get(1).toMap()).containsEntry("error", "discovery stream timed out");
        assertThat(sink.events).filteredOn(DiscoveryEvent::isTerminal).hasSize(1);
        assertThat(sink.completions.get()).isEqualTo(1);
    }

    private DiscoveryResult result(List<AcceptedCompany> companies) {
        return new DiscoveryResult("run-1", companies, 4, companies.size(), 1, 1, 6,
            List.of("curated:sector_companies"), 0, false);
    }

    private AcceptedCompany company(String ticker, int index, long marketCap) {
        TickerCandidate candidate = new TickerCandidate(ticker, new RetrievalStrategy.CuratedList("curated", List.of(ticker)), index);
        QuoteRecord record = new QuoteRecord(ticker, ticker, 10.0, marketCap, null, "Technology", null, null, null, null, Instant.now());
        return new AcceptedCompany(candidate, record);
    }

    private static final class RecordingSink implements DiscoveryEventSink {
        private final boolean disconnected;
        private final List<DiscoveryEvent> events = new CopyOnWriteArrayList<>();
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger completions = new AtomicInteger();

        private RecordingSink(boolean disconnected) {
            this.disconnected = disconnected;
        }

        @Override
        public void send(DiscoveryEvent event) throws IOException {
            attempts.incrementAndGet();
            if (disconnected) {
                throw new IOException("Broken pipe");
            }
            events.add(event);
        }

        @Override
        public void complete() {
            completions.incrementAndGet();
        }
    }
}
