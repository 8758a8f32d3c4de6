package com.fifogains.jdbc.schema;

import java.sql.Types;
import java.util.Objects;

public final class ColumnDescriptor {
    private final String name;
    private final int jdbcType;
    private final String typeName;
    private final int size;
    private final int scale;
    private final boolean nullable;
    private final String className;

    public ColumnDescriptor(
            String name,
            int jdbcType,
            String typeName,
            int size,
            int scale,
            boolean nullable,
            String className) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.size = size;
        this.scale = scale;
        this.nullable = nullable;
        this.className = Objects.requireNonNull(className, "className");
    }

    static ColumnDescriptor integer(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", 10, 0, nullable, Integer.class.getName());
    }

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "STRING", 0, 0, nullable, String.class.getName());
    }

    /** Quantities, prices and gains. */
    static ColumnDescriptor decimal(String name, boolean nullable) {
        return new ColumnDescriptor(
                name,
                Types.DECIMAL,
                "DECIMAL(" + TableDefinition.DECIMAL_PRECISION + "," + TableDefinition.DECIMAL_SCALE + ")",
                TableDefinition.DECIMAL_PRECISION,
                TableDefinition.DECIMAL_SCALE,
                nullable,
                java.math.BigDecimal.class.getName());
    }

    static ColumnDescriptor timestamp(String name) {
        return new ColumnDescriptor(name, Types.TIMESTAMP, "TIMESTAMP", 0, 0, true, java.sql.Timestamp.class.getName());
    }

    static ColumnDescriptor bool(String name) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, 0, false, Boolean.class.getName());
    }

    public String getName() {
        return name;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getSize() {
        return size;
    }

    public int getScale() {
        return scale;
    }

    public boolean isNullable() {
        return nullable;
    }

    public String getClassName() {
        return className;
    }
}
