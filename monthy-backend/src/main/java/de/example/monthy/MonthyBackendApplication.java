package de.example.monthy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MonthyBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(MonthyBackendApplication.class, args);
  }
}
