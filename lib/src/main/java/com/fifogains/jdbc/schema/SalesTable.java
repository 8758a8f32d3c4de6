package com.fifogains.jdbc.schema;

import com.fifogains.jdbc.ledger.SaleResult;
import java.util.ArrayList;
import java.util.List;

/** One row per sale with its total realized gain and how much of it had a known cost basis. */
public final class SalesTable {
    public static final String NAME = "sales";

    private static final List<ColumnDescriptor> FIXED_COLUMNS =
            List.of(
                    ColumnDescriptor.integer("sale_id", false),
                    ColumnDescriptor.integer("row_number", false),
                    ColumnDescriptor.timestamp("date"),
                    ColumnDescriptor.varchar("identifier", false),
                    ColumnDescriptor.varchar("currency", false),
                    ColumnDescriptor.decimal("sale_price", false),
                    ColumnDescriptor.decimal("sale_quantity", false),
                    ColumnDescriptor.decimal("total_gain", false),
                    ColumnDescriptor.decimal("matched_quantity", false),
                    ColumnDescriptor.decimal("unknown_quantity", false),
                    ColumnDescriptor.integer("lot_count", false));

    private SalesTable() {}

    public static TableDefinition getDefinition(List<String> extraColumns) {
        return new TableDefinition(
                NAME, "TABLE", "Sale results", TableDefinition.withExtras(FIXED_COLUMNS, extraColumns));
    }

    public static List<Object[]> materializeRows(List<SaleResult> sales, List<String> extraColumns) {
        List<Object[]> rows = new ArrayList<>(sales.size());
        for (SaleResult sale : sales) {
            Object[] fixed =
                    new Object[] {
                        sale.getSaleId(),
                        sale.getRowNumber(),
                        TableDefinition.toTimestamp(sale.getDate()),
                        sale.getIdentifier(),
                        sale.getCurrency(),
                        sale.getSalePrice(),
                        sale.getSaleQuantity(),
                        sale.getTotalGain(),
                        sale.getMatchedQuantity(),
                        sale.getUnknownQuantity(),
                        sale.getMatchedLots().size()
                    };
            rows.add(TableDefinition.withExtraValues(fixed, sale.getExtraAttributes(), extraColumns));
        }
        return rows;
    }
}
