package com.fifogains.jdbc.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Tabular input: an ordered header and the data rows keyed by header name. */
public final class RawTable {
    private final List<String> header;
    private final List<RawRecord> rows;

    public RawTable(List<String> header, List<RawRecord> rows) {
        this.header = List.copyOf(Objects.requireNonNull(header, "header"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    /** Builds a table from in-memory rows, numbering them from 1 in list order. */
    public static RawTable of(List<String> header, List<? extends Map<String, ?>> rows) {
        List<RawRecord> records = new ArrayList<>(rows.size());
        int rowNumber = 1;
        for (Map<String, ?> row : rows) {
            records.add(new RawRecord(rowNumber++, row));
        }
        return new RawTable(header, records);
    }

    public List<String> getHeader() {
        return header;
    }

    public List<RawRecord> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return header.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
