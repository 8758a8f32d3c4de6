package com.fifogains.jdbc.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * One portion of a sale funded either by a specific open lot or, when no lot was left, by an
 * unknown origin. Unknown-origin portions carry no cost basis, acquisition date or gain.
 */
public final class MatchedLot {
    private final BigDecimal usedQuantity;
    private final boolean costBasisKnown;
    private final BigDecimal costBasis;
    private final LocalDateTime acquisitionDate;
    private final BigDecimal salePrice;
    private final BigDecimal gain;

    private MatchedLot(
            BigDecimal usedQuantity,
            boolean costBasisKnown,
            BigDecimal costBasis,
            LocalDateTime acquisitionDate,
            BigDecimal salePrice,
            BigDecimal gain) {
        this.usedQuantity = Objects.requireNonNull(usedQuantity, "usedQuantity");
        this.costBasisKnown = costBasisKnown;
        this.costBasis = costBasis;
        this.acquisitionDate = acquisitionDate;
        this.salePrice = Objects.requireNonNull(salePrice, "salePrice");
        this.gain = gain;
    }

    public static MatchedLot fromLot(
            BigDecimal usedQuantity, OpenLot lot, BigDecimal salePrice, BigDecimal gain) {
        return new MatchedLot(
                usedQuantity,
                true,
                lot.getUnitPrice(),
                lot.getAcquisitionDate(),
                salePrice,
                Objects.requireNonNull(gain, "gain"));
    }

    public static MatchedLot unknownOrigin(BigDecimal usedQuantity, BigDecimal salePrice) {
        return new MatchedLot(usedQuantity, false, null, null, salePrice, null);
    }

    public BigDecimal getUsedQuantity() {
        return usedQuantity;
    }

    public boolean isCostBasisKnown() {
        return costBasisKnown;
    }

    public Optional<BigDecimal> getCostBasis() {
        return Optional.ofNullable(costBasis);
    }

    /**
     * Empty for unknown-origin portions and for lots whose buy date could not be parsed; use
     * {@link #isCostBasisKnown()} to tell the two apart.
     */
    public Optional<LocalDateTime> getAcquisitionDate() {
        return Optional.ofNullable(acquisitionDate);
    }

    public BigDecimal getSalePrice() {
        return salePrice;
    }

    public Optional<BigDecimal> getGain() {
        return Optional.ofNullable(gain);
    }
}
