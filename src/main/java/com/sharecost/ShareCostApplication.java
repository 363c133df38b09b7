package com.sharecost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShareCostApplication {
  public static void main(String[] args) {
    SpringApplication.run(ShareCostApplication.class, args);
  }
}
