package com.autoparts.stockkeeper.exception;

/**
 * Thrown when deleting a product that the sales ledger still references.
 */
public class ProductInUseException extends IllegalStateException {

    public ProductInUseException(Long productId, long salesCount) {
        super("Cannot delete product " + productId + ". It is used in " + salesCount
                + " sales records. Deactivate it instead.");
    }
}
