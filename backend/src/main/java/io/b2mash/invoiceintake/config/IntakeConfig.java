package io.b2mash.invoiceintake.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
