package com.autoparts.stockkeeper.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

public record SaleRow(
                Long id,
                Long productId,
                String productName,
                Integer quantity,
                LocalDateTime saleDate,
                BigDecimal totalAmount,
                String customerInfo,
                LocalDateTime createdAt) {

        /** Price per unit as recorded, derived from the frozen total. */
        public BigDecimal unitPrice() {
                return totalAmount.divide(BigDecimal.valueOf(quantity), 2, RoundingMode.HALF_UP);
        }
}
