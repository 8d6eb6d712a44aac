package com.smartwealth.sectors.discovery.stream;

import com.smartwealth.sectors.discovery.model.DiscoveryEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public class SseDiscoveryEventSink implements DiscoveryEventSink {
    private final SseEmitter emitter;

    public SseDiscoveryEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(DiscoveryEvent event) throws IOException {
        emitter.send(SseEmitter.event().data(event.toMap(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
