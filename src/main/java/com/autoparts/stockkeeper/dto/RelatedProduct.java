package com.autoparts.stockkeeper.dto;

import java.time.LocalDateTime;

public record RelatedProduct(
                Long relationId,
                Long mainProductId,
                ProductSummary product,
                LocalDateTime createdAt) {
}
