package com.receptionkit.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReceptionKitApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReceptionKitApplication.class, args);
  }
}
