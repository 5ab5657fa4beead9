package com.firmenakte;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FirmenakteApplication {

  public static void main(String[] args) {
    SpringApplication.run(FirmenakteApplication.class, args);
  }
}
