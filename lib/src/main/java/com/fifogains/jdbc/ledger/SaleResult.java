package com.fifogains.jdbc.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SaleResult {
    private final int saleId;
    private final TransactionRecord sale;
    private final BigDecimal totalGain;
    private final List<MatchedLot> matchedLots;

    public SaleResult(int saleId, TransactionRecord sale, BigDecimal totalGain, List<MatchedLot> matchedLots) {
        this.saleId = saleId;
        this.sale = Objects.requireNonNull(sale, "sale");
        this.totalGain = Objects.requireNonNull(totalGain, "totalGain");
        this.matchedLots = List.copyOf(matchedLots);
    }

    public int getSaleId() {
        return saleId;
    }

    public int getRowNumber() {
        return sale.getRowNumber();
    }

    public LocalDateTime getDate() {
        return sale.getDate();
    }

    public String getIdentifier() {
        return sale.getIdentifier();
    }

    public String getCurrency() {
        return sale.getCurrency();
    }

    public BigDecimal getSalePrice() {
        return sale.getPrice();
    }

    public BigDecimal getSaleQuantity() {
        return sale.getQuantity();
    }

    /** Sum of the gains of lots with a known cost basis; never absent. */
    public BigDecimal getTotalGain() {
        return totalGain;
    }

    public List<MatchedLot> getMatchedLots() {
        return matchedLots;
    }

    public Map<String, String> getExtraAttributes() {
        return sale.getExtraAttributes();
    }

    public BigDecimal getMatchedQuantity() {
        BigDecimal total = BigDecimal.ZERO;
        for (MatchedLot lot : matchedLots) {
            if (lot.isCostBasisKnown()) {
                total = total.add(lot.getUsedQuantity());
            }
        }
        return total;
    }

    public BigDecimal getUnknownQuantity() {
        BigDecimal total = BigDecimal.ZERO;
        for (MatchedLot lot : matchedLots) {
            if (!lot.isCostBasisKnown()) {
                total = total.add(lot.getUsedQuantity());
            }
        }
        return total;
    }
}
