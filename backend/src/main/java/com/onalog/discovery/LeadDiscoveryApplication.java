package com.onalog.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadDiscoveryApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadDiscoveryApplication.class, args);
  }
}
