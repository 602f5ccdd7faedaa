package com.learnscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LearnScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(LearnScraperApplication.class, args);
  }
}
