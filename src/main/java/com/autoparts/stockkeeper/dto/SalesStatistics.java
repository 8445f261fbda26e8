package com.autoparts.stockkeeper.dto;

import java.math.BigDecimal;

public record SalesStatistics(
                long totalQuantity,
                BigDecimal totalRevenue,
                BigDecimal averageSale) {

        public static final SalesStatistics EMPTY = new SalesStatistics(0, BigDecimal.ZERO, BigDecimal.ZERO);
}
