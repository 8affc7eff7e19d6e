package com.flagship.fundraising_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fundraising_ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Optional;

/**
 * Fixed-point money helpers.
 *
 * Every amount that enters the engine from outside (request bodies, stored
 * rows) goes through {@link #coerce(Object)}. Non-numeric input is rejected
 * rather than treated as zero.
 */
public final class MoneyUtil {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private MoneyUtil() {
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
    }

    /**
     * Normalizes an amount to the ledger scale. Null becomes zero.
     */
    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) {
            return zero();
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * Converts raw input into a scaled amount.
     *
     * @throws InvalidAmountException if the value is missing or not a finite number
     */
    public static BigDecimal coerce(Object raw) {
        if (raw == null) {
            throw new InvalidAmountException("Amount is missing");
        }
        if (raw instanceof BigDecimal) {
            return format((BigDecimal) raw);
        }
        if (raw instanceof JsonNode) {
            JsonNode node = (JsonNode) raw;
            if (!node.isNumber() && !node.isTextual()) {
                throw new InvalidAmountException("Amount is not numeric: " + node);
            }
            return coerce(node.asText());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidAmountException("Amount is not a finite number: " + raw);
            }
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw new InvalidAmountException("Amount is missing");
        }
        try {
            return format(new BigDecimal(text));
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not numeric: '" + text + "'", e);
        }
    }

    /**
     * Same as {@link #coerce(Object)} but returns empty instead of throwing.
     */
    public static Optional<BigDecimal> tryCoerce(Object raw) {
        try {
            return Optional.of(coerce(raw));
        } catch (InvalidAmountException e) {
            return Optional.empty();
        }
    }

    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return format(amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    /**
     * part / whole * 100 with scale 2; zero when whole is not positive.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() <= 0) {
            return zero();
        }
        return format(part).multiply(HUNDRED).divide(whole, SCALE, ROUNDING);
    }
}
