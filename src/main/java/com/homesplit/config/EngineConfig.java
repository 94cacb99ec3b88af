package com.homesplit.config;

import com.homesplit.engine.BalanceAggregator;
import com.homesplit.engine.RecurrenceExpander;
import com.homesplit.engine.SettlementEngine;
import com.homesplit.engine.SplitCalculator;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean
  public Clock clock(LedgerProperties properties) {
    if (properties.zone() == null || properties.zone().isBlank()) {
      return Clock.systemUTC();
    }
    return Clock.system(ZoneId.of(properties.zone()));
  }

  @Bean
  public SplitCalculator splitCalculator() {
    return new SplitCalculator();
  }

  @Bean
  public RecurrenceExpander recurrenceExpander() {
    return new RecurrenceExpander();
  }

  @Bean
  public BalanceAggregator balanceAggregator() {
    return new BalanceAggregator();
  }

  @Bean
  public SettlementEngine settlementEngine(Clock clock) {
    return new SettlementEngine(clock);
  }
}
