package com.mergington.hs.core;

import com.mergington.hs.core.util.HsServerProperties;
import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories(basePackages = {"com.mergington.hs.*"})
@ComponentScan(basePackages = "com.mergington.hs")
@EntityScan("com.mergington.hs")
@SpringBootApplication
public class HighSchoolApplication {

  public static void main(String[] args) {
    SpringApplication.run(HighSchoolApplication.class, args);
  }

  /**
   * Source of "now" for announcement dates; pinned to the configured school zone.
   */
  @Bean
  public Clock schoolClock(HsServerProperties serverProperties) {
    return Clock.system(serverProperties.getSchoolZoneId());
  }
}
