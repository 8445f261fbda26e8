package com.autoparts.stockkeeper.dto;

import org.springframework.data.domain.Sort;

/**
 * Catalog filter. Null fields mean "no restriction" and fall back to name
 * ascending ordering.
 */
public record ProductQuery(
                Long manufacturerId,
                String search,
                boolean includeInactive,
                ProductSortKey sortKey,
                Sort.Direction direction) {

        public static ProductQuery all() {
                return new ProductQuery(null, null, true, null, null);
        }

        public static ProductQuery activeOnly() {
                return new ProductQuery(null, null, false, null, null);
        }

        public ProductQuery forManufacturer(Long id) {
                return new ProductQuery(id, search, includeInactive, sortKey, direction);
        }

        public ProductQuery matching(String text) {
                return new ProductQuery(manufacturerId, text, includeInactive, sortKey, direction);
        }

        public ProductQuery sortedBy(ProductSortKey key, Sort.Direction dir) {
                return new ProductQuery(manufacturerId, search, includeInactive, key, dir);
        }
}
