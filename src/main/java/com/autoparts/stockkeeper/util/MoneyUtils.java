package com.autoparts.stockkeeper.util;

import com.autoparts.stockkeeper.exception.InvalidProductException;

import java.math.BigDecimal;

public final class MoneyUtils {

    public static final int SCALE = 2;
    // numeric(10,2)
    private static final int MAX_INTEGER_DIGITS = 8;
    // numeric(15,2), sales totals
    private static final int MAX_TOTAL_INTEGER_DIGITS = 13;

    private MoneyUtils() {
    }

    /**
     * Parses a price typed by the user, e.g. "2500" or "99.99".
     *
     * @throws InvalidProductException if the text is not a valid price
     */
    public static BigDecimal parsePrice(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidProductException("Price is required.");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            throw new InvalidProductException("Invalid price format: " + text, e);
        }
        return normalizePrice(value);
    }

    /**
     * Validates a price and brings it to the stored scale without rounding.
     */
    public static BigDecimal normalizePrice(BigDecimal price) {
        if (price == null) {
            throw new InvalidProductException("Price is required.");
        }
        if (price.signum() < 0) {
            throw new InvalidProductException("Price cannot be negative.");
        }
        BigDecimal stripped = price.stripTrailingZeros();
        if (stripped.scale() > SCALE) {
            throw new InvalidProductException("Price cannot have more than " + SCALE + " decimal places: " + price);
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidProductException("Price is too large: " + price);
        }
        return price.setScale(SCALE);
    }

    /**
     * Whether a sale total fits the ledger's total column.
     */
    public static boolean fitsTotal(BigDecimal total) {
        BigDecimal stripped = total.stripTrailingZeros();
        return stripped.precision() - stripped.scale() <= MAX_TOTAL_INTEGER_DIGITS;
    }
}
