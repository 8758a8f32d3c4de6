package com.fifogains.jdbc.schema;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column layout of one SQL table. Tables that carry the extra identification columns append them
 * after their fixed columns; an extra column whose name clashes with a fixed one is exposed with
 * an {@value #EXTRA_PREFIX} prefix.
 */
public final class TableDefinition {
    static final int DECIMAL_PRECISION = 19;
    static final int DECIMAL_SCALE = 8;
    static final String EXTRA_PREFIX = "extra_";

    private final String name;
    private final String type;
    private final String remarks;
    private final List<ColumnDescriptor> columns;

    public TableDefinition(String name, String type, String remarks, List<ColumnDescriptor> columns) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.remarks = remarks;
        this.columns = List.copyOf(columns);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getRemarks() {
        return remarks;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnDescriptor column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    static List<ColumnDescriptor> withExtras(List<ColumnDescriptor> fixed, List<String> extraColumns) {
        List<ColumnDescriptor> all = new ArrayList<>(fixed);
        List<String> taken = new ArrayList<>();
        for (ColumnDescriptor column : fixed) {
            taken.add(column.getName());
        }
        for (String extra : extraColumns) {
            String name = extra;
            while (taken.contains(name)) {
                name = EXTRA_PREFIX + name;
            }
            taken.add(name);
            all.add(ColumnDescriptor.varchar(name, true));
        }
        return all;
    }

    /** Copies the fixed values into a row wide enough for the extras and fills those in. */
    static Object[] withExtraValues(Object[] fixed, Map<String, String> attributes, List<String> extraColumns) {
        Object[] row = new Object[fixed.length + extraColumns.size()];
        System.arraycopy(fixed, 0, row, 0, fixed.length);
        for (int i = 0; i < extraColumns.size(); i++) {
            row[fixed.length + i] = attributes.get(extraColumns.get(i));
        }
        return row;
    }

    /** Calcite's internal representation of a TIMESTAMP: epoch millis, zone-less. */
    static Long toTimestamp(LocalDateTime value) {
        return value == null ? null : value.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
