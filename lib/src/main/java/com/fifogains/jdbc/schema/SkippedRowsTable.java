package com.fifogains.jdbc.schema;

import com.fifogains.jdbc.loader.SkippedRow;
import java.util.ArrayList;
import java.util.List;

public final class SkippedRowsTable {
    public static final String NAME = "skipped_rows";

    private static final TableDefinition DEFINITION = createDefinition();

    private SkippedRowsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<SkippedRow> skipped) {
        List<Object[]> rows = new ArrayList<>(skipped.size());
        for (SkippedRow row : skipped) {
            rows.add(new Object[] {row.getRowNumber(), row.getReason().name(), row.getDetail()});
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(ColumnDescriptor.integer("row_number", false));
        columns.add(ColumnDescriptor.varchar("reason", false));
        columns.add(ColumnDescriptor.varchar("detail", true));
        return new TableDefinition(NAME, "TABLE", "Rows excluded from matching", columns);
    }
}
