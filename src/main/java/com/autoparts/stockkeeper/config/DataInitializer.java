package com.autoparts.stockkeeper.config;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    @Bean
    @ConditionalOnProperty(prefix = "shop.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
    CommandLineRunner init(SampleDataSeeder seeder) {
        return args -> seeder.seed();
    }
}
