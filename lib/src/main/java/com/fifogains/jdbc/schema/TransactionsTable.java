package com.fifogains.jdbc.schema;

import com.fifogains.jdbc.ledger.TransactionRecord;
import java.util.ArrayList;
import java.util.List;

/** Normalized transactions in source order, one row per buy or sell that survived loading. */
public final class TransactionsTable {
    public static final String NAME = "transactions";

    private static final List<ColumnDescriptor> FIXED_COLUMNS =
            List.of(
                    ColumnDescriptor.integer("row_number", false),
                    ColumnDescriptor.timestamp("date"),
                    ColumnDescriptor.varchar("raw_date", true),
                    ColumnDescriptor.varchar("kind", false),
                    ColumnDescriptor.varchar("identifier", false),
                    ColumnDescriptor.varchar("currency", false),
                    ColumnDescriptor.decimal("quantity", false),
                    ColumnDescriptor.decimal("price", false));

    private TransactionsTable() {}

    public static TableDefinition getDefinition(List<String> extraColumns) {
        return new TableDefinition(
                NAME, "TABLE", "Normalized transactions", TableDefinition.withExtras(FIXED_COLUMNS, extraColumns));
    }

    public static List<Object[]> materializeRows(List<TransactionRecord> transactions, List<String> extraColumns) {
        List<Object[]> rows = new ArrayList<>(transactions.size());
        for (TransactionRecord transaction : transactions) {
            Object[] fixed =
                    new Object[] {
                        transaction.getRowNumber(),
                        TableDefinition.toTimestamp(transaction.getDate()),
                        transaction.getRawDate(),
                        transaction.getKind().name(),
                        transaction.getIdentifier(),
                        transaction.getCurrency(),
                        transaction.getQuantity(),
                        transaction.getPrice()
                    };
            rows.add(TableDefinition.withExtraValues(fixed, transaction.getExtraAttributes(), extraColumns));
        }
        return rows;
    }
}
