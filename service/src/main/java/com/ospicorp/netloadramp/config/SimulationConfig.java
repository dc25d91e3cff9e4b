package com.ospicorp.netloadramp.config;

import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SimulationConfig {
  private static final Logger log = LoggerFactory.getLogger(SimulationConfig.class);

  // Attached to request data that does not describe its own simulation
  @Bean
  SimulationOptions defaultSimulationOptions(
      @Value("${ramp.simulation.name:default}") String name,
      @Value("${ramp.simulation.start:2018-01-01}") String start,
      @Value("${ramp.simulation.first-weekday:monday}") String firstWeekday,
      @Value("${ramp.simulation.mc-years:1}") int mcYears) {
    SimulationOptions options = new SimulationOptions(name, LocalDate.parse(start),
        DayOfWeek.valueOf(firstWeekday.toUpperCase(Locale.ROOT)), mcYears);
    log.info("Default simulation options: {}", options);
    return options;
  }
}
