package com.fifogains.jdbc.loader.validation;

import com.fifogains.jdbc.loader.ErrorKind;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.RawTable;
import java.util.List;

/** Rejects tables without data rows or with fewer than the four columns a transaction needs. */
final class ColumnCountValidationRule implements ValidationRule {

    static final int MINIMUM_COLUMNS = 4;

    @Override
    public List<LoaderMessage> validate(RawTable table, FifoOptions options) {
        if (table.isEmpty() || table.getColumnCount() < MINIMUM_COLUMNS) {
            return List.of(
                    LoaderMessage.error(
                            ErrorKind.SCHEMA,
                            "Source table must contain at least four columns of data (found "
                                    + table.getColumnCount()
                                    + " columns, "
                                    + table.getRows().size()
                                    + " rows)"));
        }
        return List.of();
    }
}
