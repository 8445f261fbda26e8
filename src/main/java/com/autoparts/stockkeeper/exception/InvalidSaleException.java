package com.autoparts.stockkeeper.exception;

public class InvalidSaleException extends IllegalArgumentException {

    public InvalidSaleException(String message) {
        super(message);
    }
}
