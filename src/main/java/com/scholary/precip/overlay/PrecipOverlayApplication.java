package com.scholary.precip.overlay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrecipOverlayApplication {

  public static void main(String[] args) {
    SpringApplication.run(PrecipOverlayApplication.class, args);
  }
}
