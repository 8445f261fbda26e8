package com.autoparts.stockkeeper.dto;

public enum ProductSortKey {
    NAME("name"),
    PRICE("price");

    private final String property;

    ProductSortKey(String property) {
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
