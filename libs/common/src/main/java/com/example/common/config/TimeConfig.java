/*
 * Where: common Spring configuration
 * What: exposes the UTC system clock as an injectable bean
 * Why: components read time through Clock so tests can pin it
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
