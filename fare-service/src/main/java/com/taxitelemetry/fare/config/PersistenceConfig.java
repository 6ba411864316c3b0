package com.taxitelemetry.fare.config;

import lombok.extern.slf4j.Slf4j;
import org.hibernate.boot.model.naming.PhysicalNamingStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class PersistenceConfig {

    @Bean
    public PhysicalNamingStrategy tripTableNamingStrategy(FareSettings settings) {
        TripTableNamingStrategy strategy = new TripTableNamingStrategy(settings.getTableName());
        log.info("Trip records stored in table {}", strategy.getTableName());
        return strategy;
    }
}
