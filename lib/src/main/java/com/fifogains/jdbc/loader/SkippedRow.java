package com.fifogains.jdbc.loader;

import java.util.Objects;

/** A source row that did not take part in matching, and why. */
public final class SkippedRow {
    private final int rowNumber;
    private final ErrorKind reason;
    private final String detail;

    public SkippedRow(int rowNumber, ErrorKind reason, String detail) {
        this.rowNumber = rowNumber;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.detail = detail;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public ErrorKind getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }
}
