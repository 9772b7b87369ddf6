package com.okazje.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OkazjeScannerApplication {

  public static void main(String[] args) {
    SpringApplication.run(OkazjeScannerApplication.class, args);
  }
}
