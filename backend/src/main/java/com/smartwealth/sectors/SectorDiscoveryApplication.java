package com.smartwealth.sectors;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SectorDiscoveryApplication {

  public static void main(String[] args) {
    SpringApplication.run(SectorDiscoveryApplication.class, args);
  }
}
