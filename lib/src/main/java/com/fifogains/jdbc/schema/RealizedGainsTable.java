package com.fifogains.jdbc.schema;

import com.fifogains.jdbc.ledger.ResultRow;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per matched lot. Portions of unknown origin have {@code cost_basis_known = FALSE} and
 * NULL cost basis, buy date and gain; the rendered date columns keep the display text.
 */
public final class RealizedGainsTable {
    public static final String NAME = "realized_gains";

    private static final List<ColumnDescriptor> FIXED_COLUMNS =
            List.of(
                    ColumnDescriptor.integer("sale_id", false),
                    ColumnDescriptor.integer("lot_index", false),
                    ColumnDescriptor.varchar("identifier", false),
                    ColumnDescriptor.varchar("currency", false),
                    ColumnDescriptor.timestamp("buy_date"),
                    ColumnDescriptor.varchar("buy_date_text", false),
                    ColumnDescriptor.decimal("buy_price", true),
                    ColumnDescriptor.timestamp("sell_date"),
                    ColumnDescriptor.varchar("sell_date_text", false),
                    ColumnDescriptor.decimal("sell_price", false),
                    ColumnDescriptor.decimal("sell_quantity", false),
                    ColumnDescriptor.decimal("used_quantity", false),
                    ColumnDescriptor.bool("cost_basis_known"),
                    ColumnDescriptor.decimal("gain", true));

    private RealizedGainsTable() {}

    public static TableDefinition getDefinition(List<String> extraColumns) {
        return new TableDefinition(
                NAME, "TABLE", "Matched lots per sale", TableDefinition.withExtras(FIXED_COLUMNS, extraColumns));
    }

    public static List<Object[]> materializeRows(List<ResultRow> resultRows, List<String> extraColumns) {
        List<Object[]> rows = new ArrayList<>(resultRows.size());
        for (ResultRow row : resultRows) {
            Object[] fixed =
                    new Object[] {
                        row.getSaleId(),
                        row.getLotIndex(),
                        row.getIdentifier(),
                        row.getCurrency(),
                        TableDefinition.toTimestamp(row.getAcquisitionDate()),
                        row.getAcquisitionDateText(),
                        row.getCostBasis(),
                        TableDefinition.toTimestamp(row.getSaleDate()),
                        row.getSaleDateText(),
                        row.getSalePrice(),
                        row.getSaleQuantity(),
                        row.getUsedQuantity(),
                        row.isCostBasisKnown(),
                        row.getGain()
                    };
            rows.add(TableDefinition.withExtraValues(fixed, row.getExtraAttributes(), extraColumns));
        }
        return rows;
    }
}
