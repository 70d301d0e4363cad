package com.delta.listingimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ListingImportApplication {

  public static void main(String[] args) {
    SpringApplication.run(ListingImportApplication.class, args);
  }
}
