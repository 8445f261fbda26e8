package com.autoparts.stockkeeper.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "shop")
public class ShopProperties {

    private Seed seed = new Seed();

    @Getter
    @Setter
    public static class Seed {
        // Insert demonstration data on startup when the tables are empty
        private boolean enabled = true;
        private int salesCount = 50;
        private int salesDaysBack = 365;
    }
}
