package com.autoparts.stockkeeper.dto;

import java.math.BigDecimal;

/**
 * Values entered for a product. A null id means a new product.
 */
public record ProductForm(
                Long id,
                String name,
                BigDecimal price,
                String description,
                String imagePath,
                Long manufacturerId,
                boolean active) {

        public static ProductForm create(String name, BigDecimal price, Long manufacturerId) {
                return new ProductForm(null, name, price, null, null, manufacturerId, true);
        }

        public ProductForm withId(Long newId) {
                return new ProductForm(newId, name, price, description, imagePath, manufacturerId, active);
        }

        public ProductForm withPrice(BigDecimal newPrice) {
                return new ProductForm(id, name, newPrice, description, imagePath, manufacturerId, active);
        }

        public ProductForm withActive(boolean newActive) {
                return new ProductForm(id, name, price, description, imagePath, manufacturerId, newActive);
        }
}
