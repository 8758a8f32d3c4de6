package com.fifogains.jdbc.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened output row: one matched lot of one sale, with the sale's identification carried
 * alongside. Typed accessors keep unknown values as {@code null}; {@link #toMap(boolean)} renders
 * them with the {@value #UNKNOWN} and {@value #INVALID_DATE} literals.
 */
public final class ResultRow {
    public static final String UNKNOWN = "Unknown";
    public static final String INVALID_DATE = "Invalid Date";

    public static final String IDENTIFIER = "Identifier";
    public static final String BUY_DATE = "Buy Date";
    public static final String BUY_PRICE = "Buy Price";
    public static final String SELL_DATE = "Sell Date";
    public static final String SELL_PRICE = "Sell Price";
    public static final String SELL_QTY = "Sell Qty";
    public static final String USED_QTY = "Used Qty";
    public static final String GAIN_LOSS = "Gain/Loss";
    public static final String CURRENCY = "Currency";

    private static final List<String> BASE_COLUMNS =
            List.of(IDENTIFIER, BUY_DATE, BUY_PRICE, SELL_DATE, SELL_PRICE, SELL_QTY, USED_QTY, GAIN_LOSS);

    private final int saleId;
    private final int lotIndex;
    private final SaleResult sale;
    private final MatchedLot lot;
    private final String saleDateText;
    private final String acquisitionDateText;

    public ResultRow(
            int saleId,
            int lotIndex,
            SaleResult sale,
            MatchedLot lot,
            String saleDateText,
            String acquisitionDateText) {
        this.saleId = saleId;
        this.lotIndex = lotIndex;
        this.sale = Objects.requireNonNull(sale, "sale");
        this.lot = Objects.requireNonNull(lot, "lot");
        this.saleDateText = Objects.requireNonNull(saleDateText, "saleDateText");
        this.acquisitionDateText = Objects.requireNonNull(acquisitionDateText, "acquisitionDateText");
    }

    /** Rendered column names in output order. */
    public static List<String> columnNames(boolean includeCurrency, List<String> extraColumns) {
        List<String> names = new ArrayList<>(BASE_COLUMNS);
        if (includeCurrency) {
            names.add(CURRENCY);
        }
        for (String column : extraColumns) {
            if (!names.contains(column)) {
                names.add(column);
            }
        }
        return names;
    }

    public int getSaleId() {
        return saleId;
    }

    public int getLotIndex() {
        return lotIndex;
    }

    public String getIdentifier() {
        return sale.getIdentifier();
    }

    public String getCurrency() {
        return sale.getCurrency();
    }

    public LocalDateTime getSaleDate() {
        return sale.getDate();
    }

    public String getSaleDateText() {
        return saleDateText;
    }

    public BigDecimal getSalePrice() {
        return sale.getSalePrice();
    }

    public BigDecimal getSaleQuantity() {
        return sale.getSaleQuantity();
    }

    public BigDecimal getUsedQuantity() {
        return lot.getUsedQuantity();
    }

    public boolean isCostBasisKnown() {
        return lot.isCostBasisKnown();
    }

    public BigDecimal getCostBasis() {
        return lot.getCostBasis().orElse(null);
    }

    public LocalDateTime getAcquisitionDate() {
        return lot.getAcquisitionDate().orElse(null);
    }

    public String getAcquisitionDateText() {
        return acquisitionDateText;
    }

    public BigDecimal getGain() {
        return lot.getGain().orElse(null);
    }

    public Map<String, String> getExtraAttributes() {
        return sale.getExtraAttributes();
    }

    /**
     * Renders this row as a flat column map. Numbers stay {@link BigDecimal}; unknown cost basis and
     * gain become {@value #UNKNOWN}. An extra column named like a fixed column replaces its value.
     */
    public Map<String, Object> toMap(boolean includeCurrency) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(IDENTIFIER, getIdentifier());
        map.put(BUY_DATE, acquisitionDateText);
        map.put(BUY_PRICE, lot.getCostBasis().<Object>map(value -> value).orElse(UNKNOWN));
        map.put(SELL_DATE, saleDateText);
        map.put(SELL_PRICE, getSalePrice());
        map.put(SELL_QTY, getSaleQuantity());
        map.put(USED_QTY, getUsedQuantity());
        map.put(GAIN_LOSS, lot.getGain().<Object>map(value -> value).orElse(UNKNOWN));
        if (includeCurrency) {
            map.put(CURRENCY, getCurrency());
        }
        map.putAll(getExtraAttributes());
        return map;
    }
}
