package com.fifogains.jdbc.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One source row before normalization: column name to raw value, numbered from 1. */
public final class RawRecord {
    private final int rowNumber;
    private final Map<String, Object> values;

    public RawRecord(int rowNumber, Map<String, ?> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public Object get(String column) {
        return values.get(column);
    }

    /** True when the column is absent, null, or holds only whitespace. */
    public boolean isMissing(String column) {
        Object value = values.get(column);
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }

    public Map<String, Object> getValues() {
        return values;
    }
}
