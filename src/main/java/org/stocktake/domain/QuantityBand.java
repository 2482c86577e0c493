package org.stocktake.domain;

import java.math.BigDecimal;

/**
 * 数量等级
 * - CRITICAL: quantity < min
 * - LOW: min <= quantity < min * 1.5
 * - HEALTHY: quantity >= min * 1.5
 */
public enum QuantityBand {
    CRITICAL,
    LOW,
    HEALTHY;

    private static final BigDecimal LOW_FACTOR = new BigDecimal("1.5");

    public static QuantityBand classify(BigDecimal quantity, BigDecimal minQuantity) {
        BigDecimal q = quantity == null ? BigDecimal.ZERO : quantity;
        BigDecimal min = minQuantity == null ? BigDecimal.ZERO : minQuantity;
        if (q.compareTo(min) < 0) {
            return CRITICAL;
        }
        if (q.compareTo(min.multiply(LOW_FACTOR)) < 0) {
            return LOW;
        }
        return HEALTHY;
    }
}
