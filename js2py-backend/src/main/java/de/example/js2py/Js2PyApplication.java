package de.example.js2py;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Js2PyApplication {

  public static void main(String[] args) {
    SpringApplication.run(Js2PyApplication.class, args);
  }
}
