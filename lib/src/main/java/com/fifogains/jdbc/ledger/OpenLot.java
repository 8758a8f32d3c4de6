package com.fifogains.jdbc.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Unconsumed portion of a buy. The remaining quantity shrinks in place while sells consume the lot
 * and the owning queue drops the lot once it reaches zero.
 */
public final class OpenLot {
    private BigDecimal remainingQuantity;
    private final BigDecimal unitPrice;
    private final LocalDateTime acquisitionDate;

    public OpenLot(BigDecimal remainingQuantity, BigDecimal unitPrice, LocalDateTime acquisitionDate) {
        this.remainingQuantity = Objects.requireNonNull(remainingQuantity, "remainingQuantity");
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
        this.acquisitionDate = acquisitionDate;
    }

    public static OpenLot fromBuy(TransactionRecord buy) {
        return new OpenLot(buy.getQuantity(), buy.getPrice(), buy.getDate());
    }

    public BigDecimal getRemainingQuantity() {
        return remainingQuantity;
    }

    /**
     * Removes {@code used} units from this lot.
     *
     * @return {@code true} once the lot is exhausted
     */
    public boolean consume(BigDecimal used) {
        if (used.compareTo(remainingQuantity) > 0) {
            throw new IllegalArgumentException(
                    "Cannot consume " + used + " from lot holding " + remainingQuantity);
        }
        remainingQuantity = remainingQuantity.subtract(used);
        return remainingQuantity.signum() == 0;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    /** Acquisition date, {@code null} when the funding buy carried an unparsable date. */
    public LocalDateTime getAcquisitionDate() {
        return acquisitionDate;
    }

    public OpenLot copy() {
        return new OpenLot(remainingQuantity, unitPrice, acquisitionDate);
    }
}
