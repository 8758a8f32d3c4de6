package com.fifogains.jdbc.loader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps the canonical transaction fields onto source column names. Only the currency is optional. */
public final class ColumnMapping {
    private final String dateColumn;
    private final String typeColumn;
    private final String quantityColumn;
    private final String priceColumn;
    private final String identifierColumn;
    private final String currencyColumn;

    public ColumnMapping(
            String dateColumn,
            String typeColumn,
            String quantityColumn,
            String priceColumn,
            String identifierColumn,
            String currencyColumn) {
        this.dateColumn = blankToNull(dateColumn);
        this.typeColumn = blankToNull(typeColumn);
        this.quantityColumn = blankToNull(quantityColumn);
        this.priceColumn = blankToNull(priceColumn);
        this.identifierColumn = blankToNull(identifierColumn);
        this.currencyColumn = blankToNull(currencyColumn);
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public String getTypeColumn() {
        return typeColumn;
    }

    public String getQuantityColumn() {
        return quantityColumn;
    }

    public String getPriceColumn() {
        return priceColumn;
    }

    public String getIdentifierColumn() {
        return identifierColumn;
    }

    public String getCurrencyColumn() {
        return currencyColumn;
    }

    public boolean hasCurrencyColumn() {
        return currencyColumn != null;
    }

    /** Field label to column name for the mandatory fields, {@code null} where unmapped. */
    public Map<String, String> requiredFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("identifier", identifierColumn);
        fields.put("date", dateColumn);
        fields.put("type", typeColumn);
        fields.put("quantity", quantityColumn);
        fields.put("price", priceColumn);
        return fields;
    }

    /** Every mapped column, mandatory ones first, then the currency column when present. */
    public List<String> mappedColumns() {
        List<String> columns = new ArrayList<>();
        for (String column : requiredFields().values()) {
            if (column != null) {
                columns.add(column);
            }
        }
        if (currencyColumn != null) {
            columns.add(currencyColumn);
        }
        return columns;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
