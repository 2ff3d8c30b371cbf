/*
 * Where: shared configuration
 * What: Exposes the process Clock as a bean
 * Why: Services read "now" from one injectable source so tests can pin it
 */
package com.safetyops.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
