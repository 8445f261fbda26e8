package com.autoparts.stockkeeper.repository;

import com.autoparts.stockkeeper.model.Product;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

public final class ProductSpecifications {

    private ProductSpecifications() {
    }

    public static Specification<Product> hasManufacturer(Long manufacturerId) {
        return (root, query, cb) -> cb.equal(root.get("manufacturer").get("id"), manufacturerId);
    }

    public static Specification<Product> nameContains(String text) {
        String pattern = "%" + text.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("name")), pattern);
    }

    public static Specification<Product> isActive() {
        return (root, query, cb) -> cb.isTrue(root.get("active"));
    }
}
