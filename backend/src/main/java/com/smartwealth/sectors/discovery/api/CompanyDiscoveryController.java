package com.smartwealth.sectors.discovery.api;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.CompanyView;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.DiscoveryResult;
import com.smartwealth.sectors.discovery.service.CompanyDiscoveryService;
import com.smartwealth.sectors.discovery.source.SourceRegistry;
import com.smartwealth.sectors.discovery.stream.DiscoveryStreamService;
import com.smartwealth.sectors.discovery.stream.SseDiscoveryEventSink;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api")
public class CompanyDiscoveryController {
    private final CompanyDiscoveryService discoveryService;
    private final DiscoveryStreamService streamService;
    private final SourceRegistry sourceRegistry;
    private final DiscoveryProperties properties;

    public CompanyDiscoveryController(
        CompanyDiscoveryService discoveryService,
        DiscoveryStreamService streamService,
        SourceRegistry sourceRegistry,
        DiscoveryProperties properties
    ) {
        this.discoveryService = discoveryService;
        this.streamService = streamService;
        this.sourceRegistry = sourceRegistry;
        this.properties = properties;
    }

    /**
     * Streams Server-Sent Events unless the body sets {@code streaming} to false, in which case
     * it answers with one JSON document. A client accepting {@code text/event-stream} always streams.
     */
    @PostMapping("/companies/dynamic")
    public Object discoverCompanies(
        @RequestBody(required = false) DiscoveryApiRequest request,
        @RequestHeader(name = HttpHeaders.ACCEPT, required = false) String accept
    ) {
        boolean streaming = request == null || request.streaming() == null || request.streaming() || acceptsEventStream(accept);
        DiscoveryRequest discoveryRequest = toDiscoveryRequest(request, streaming);

        if (streaming) {
            SseEmitter emitter = new SseEmitter(TimeUnit.SECONDS.toMillis(properties.getStream().getTimeoutSeconds()));
            streamService.stream(discoveryRequest, new SseDiscoveryEventSink(emitter));
            return emitter;
        }

        DiscoveryResult result = discoveryService.discover(discoveryRequest);
        List<CompanyView> companies = result.companies().stream()
            .map(AcceptedCompany::record)
            .map(CompanyView::from)
            .toList();
        return new DiscoveryResponse(
            discoveryRequest.sectors(),
            discoveryRequest.subsectors(),
            companies,
            companies.size(),
            discoveryRequest.limit(),
            result.considered(),
            result.accepted(),
            result.rejected(),
            result.strategies(),
            Instant.now()
        );
    }

    @GetMapping("/companies/catalog")
    public CatalogResponse catalog() {
        return new CatalogResponse(
            sourceRegistry.catalogVersion(),
            sourceRegistry.knownSectors(),
            sourceRegistry.knownSubsectors()
        );
    }

    private DiscoveryRequest toDiscoveryRequest(DiscoveryApiRequest request, boolean streaming) {
        if (request == null) {
            throw new IllegalArgumentException("Please select at least one sector or subsector");
        }
        int limit = request.limit() == null
            ? properties.getApi().getDefaultLimit()
            : Math.max(1, Math.min(request.limit(), properties.getApi().getMaxLimit()));
        DiscoveryRequest discoveryRequest = DiscoveryRequest.of(request.sectors(), request.subsectors(), limit, streaming);
        if (discoveryRequest.isEmpty()) {
            throw new IllegalArgumentException("Please select at least one sector or subsector");
        }
        return discoveryRequest;
    }

    private boolean acceptsEventStream(String accept) {
        if (accept == null || accept.isBlank()) {
            return false;
        }
        for (MediaType mediaType : MediaType.parseMediaTypes(accept)) {
            if (MediaType.TEXT_EVENT_STREAM.equalsTypeAndSubtype(mediaType)) {
                return true;
            }
        }
        return false;
    }
}
