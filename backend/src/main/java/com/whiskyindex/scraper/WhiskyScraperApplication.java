package com.whiskyindex.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WhiskyScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(WhiskyScraperApplication.class, args);
  }
}
