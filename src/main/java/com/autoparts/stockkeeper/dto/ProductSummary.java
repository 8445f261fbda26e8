package com.autoparts.stockkeeper.dto;

import com.autoparts.stockkeeper.model.Product;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product as shown in the catalog, decorated with the manufacturer display
 * name and the number of outgoing relation edges. Neither value is stored on
 * the product row.
 */
public record ProductSummary(
                Long id,
                String name,
                BigDecimal price,
                String description,
                String imagePath,
                Long manufacturerId,
                String manufacturerName,
                boolean active,
                LocalDateTime createdAt,
                LocalDateTime updatedAt,
                long relatedProductsCount) {

        public static ProductSummary of(Product product, long relatedProductsCount) {
                Long manufacturerId = null;
                String manufacturerName = null;
                if (product.getManufacturer() != null) {
                        manufacturerId = product.getManufacturer().getId();
                        manufacturerName = product.getManufacturer().getName();
                }
                return new ProductSummary(product.getId(), product.getName(), product.getPrice(),
                                product.getDescription(), product.getImagePath(), manufacturerId, manufacturerName,
                                product.isActive(), product.getCreatedAt(), product.getUpdatedAt(),
                                relatedProductsCount);
        }
}
