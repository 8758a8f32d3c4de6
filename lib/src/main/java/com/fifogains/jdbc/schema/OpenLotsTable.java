package com.fifogains.jdbc.schema;

import com.fifogains.jdbc.ledger.OpenLot;
import com.fifogains.jdbc.ledger.RemainingLot;
import java.util.ArrayList;
import java.util.List;

/** Lots still held after all sales were matched; position 0 would be consumed first. */
public final class OpenLotsTable {
    public static final String NAME = "open_lots";

    private static final TableDefinition DEFINITION = createDefinition();

    private OpenLotsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<RemainingLot> lots) {
        List<Object[]> rows = new ArrayList<>(lots.size());
        for (RemainingLot remaining : lots) {
            OpenLot lot = remaining.getLot();
            rows.add(
                    new Object[] {
                        remaining.getKey().identifier(),
                        remaining.getKey().currency(),
                        remaining.getPosition(),
                        lot.getRemainingQuantity(),
                        lot.getUnitPrice(),
                        TableDefinition.toTimestamp(lot.getAcquisitionDate())
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(ColumnDescriptor.varchar("identifier", false));
        columns.add(ColumnDescriptor.varchar("currency", false));
        columns.add(ColumnDescriptor.integer("position", false));
        columns.add(ColumnDescriptor.decimal("remaining_quantity", false));
        columns.add(ColumnDescriptor.decimal("unit_price", false));
        columns.add(ColumnDescriptor.timestamp("acquisition_date"));
        return new TableDefinition(NAME, "TABLE", "Open lots after matching", columns);
    }
}
