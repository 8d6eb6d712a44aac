package com.smartwealth.sectors.discovery.stream;

import com.smartwealth.sectors.discovery.model.DiscoveryEvent;

import java.io.IOException;

public interface DiscoveryEventSink {
    void send(DiscoveryEvent event) throws IOException;

    void complete();
}
