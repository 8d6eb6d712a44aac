package com.smartwealth.sectors.discovery.stream;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.CompanyView;
import com.smartwealth.sectors.discovery.model.DiscoveryEvent;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.DiscoveryResult;
import com.smartwealth.sectors.discovery.service.CatastrophicDiscoveryException;
import com.smartwealth.sectors.discovery.service.CompanyDiscoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a discovery and forwards its events to a sink: {@code started}, one {@code progress}
 * per accepted company, then exactly one {@code completed} or {@code error}.
 */
@Service
public class DiscoveryStreamService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryStreamService.class);

    private final CompanyDiscoveryService discoveryService;
    private final DiscoveryProperties properties;
    private final ExecutorService streamExecutor;

    public DiscoveryStreamService(
        CompanyDiscoveryService discoveryService,
        DiscoveryProperties properties,
        @Qualifier("streamExecutor") ExecutorService streamExecutor
    ) {
        this.discoveryService = discoveryService;
        this.properties = properties;
        this.streamExecutor = streamExecutor;
    }

    /** Starts producer and consumer; the returned future completes once the sink has been closed. */
    public CompletableFuture<Void> stream(DiscoveryRequest request, DiscoveryEventSink sink) {
        DiscoveryEventChannel channel = new DiscoveryEventChannel(properties.getStream().getChannelCapacity());
        CompletableFuture.runAsync(() -> produce(request, channel), streamExecutor);
        return CompletableFuture.runAsync(() -> consume(channel, sink), streamExecutor);
    }

    private void produce(DiscoveryRequest request, DiscoveryEventChannel channel) {
        channel.publish(DiscoveryEvent.started(request.sectors(), request.subsectors(), request.limit()));
        try {
            DiscoveryResult result = discoveryService.discover(
                request,
                (company, index) -> {
                    if (!channel.isClosed()) {
                        channel.publish(DiscoveryEvent.progress(CompanyView.from(company.record()), index, request.limit()));
                    }
                }
            );
            List<CompanyView> companies = result.companies().stream()
                .map(AcceptedCompany::record)
                .map(CompanyView::from)
                .toList();
            channel.publish(DiscoveryEvent.completed(result, companies));
        } catch (CatastrophicDiscoveryException | IllegalArgumentException e) {
            channel.publish(DiscoveryEvent.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Discovery stream producer failed", e);
            channel.publish(DiscoveryEvent.error("discovery failed: " + e.getMessage()));
        }
    }

    private void consume(DiscoveryEventChannel channel, DiscoveryEventSink sink) {
        long timeoutSeconds = properties.getStream().getTimeoutSeconds();
        boolean clientConnected = true;
        try {
            while (true) {
                DiscoveryEvent event = channel.poll(timeoutSeconds, TimeUnit.SECONDS);
                if (event == null) {
                    if (!channel.close()) {
                        // producer's terminal event is queued or about to be
                        continue;
                    }
                    log.warn("Discovery stream timed out after {}s without a terminal event", timeoutSeconds);
                    event = DiscoveryEvent.error("discovery stream timed out");
                }
                if (clientConnected) {
                    clientConnected = forward(sink, event);
                }
                if (event.isTerminal()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Discovery stream consumer interrupted");
        } finally {
            if (clientConnected) {
                sink.complete();
            }
        }
    }

    private boolean forward(DiscoveryEventSink sink, DiscoveryEvent event) {
        try {
            sink.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.info("Stream client went away, draining remaining events: {}", e.getMessage());
            return false;
        }
    }
}
