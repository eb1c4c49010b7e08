package com.delta.jobharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobHarvestApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobHarvestApplication.class, args);
  }
}
