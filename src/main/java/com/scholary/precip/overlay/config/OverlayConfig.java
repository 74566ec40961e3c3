package com.scholary.precip.overlay.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for overlay-related beans.
 *
 * <p>Enables the overlay and toolchain properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({OverlayProperties.class, ToolchainProperties.class})
public class OverlayConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
