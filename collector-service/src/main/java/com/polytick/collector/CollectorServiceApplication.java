package com.polytick.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CollectorServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(CollectorServiceApplication.class, args);
  }
}
