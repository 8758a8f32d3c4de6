package com.fifogains.jdbc.loader;

import com.fifogains.jdbc.ledger.TransactionKind;
import com.fifogains.jdbc.ledger.TransactionRecord;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw rows into {@link TransactionRecord}s. Rows with a missing mapped value, an unparsable
 * quantity or price, or an unrecognized type are dropped and reported; an unparsable date only
 * produces a warning and the row is kept with a {@code null} date.
 */
final class TransactionNormalizer {

    private final FifoOptions options;
    private final List<TransactionRecord> transactions = new ArrayList<>();
    private final List<SkippedRow> skippedRows = new ArrayList<>();
    private final List<LoaderMessage> messages = new ArrayList<>();

    TransactionNormalizer(FifoOptions options) {
        this.options = options;
    }

    void normalize(RawTable table) {
        ColumnMapping columns = options.getColumns();
        List<String> required = options.requiredColumns();
        int missingCount = 0;
        for (RawRecord row : table.getRows()) {
            String missingColumn = firstMissing(row, required);
            if (missingColumn != null) {
                missingCount++;
                skippedRows.add(
                        new SkippedRow(
                                row.getRowNumber(),
                                ErrorKind.MISSING_VALUE,
                                "Missing value in column " + missingColumn));
                continue;
            }

            BigDecimal quantity;
            BigDecimal price;
            try {
                quantity = DecimalParser.parse(row.get(columns.getQuantityColumn()));
                price = DecimalParser.parse(row.get(columns.getPriceColumn()));
            } catch (RowParseException ex) {
                skippedRows.add(new SkippedRow(row.getRowNumber(), ErrorKind.ROW_PARSE, ex.getMessage()));
                messages.add(
                        LoaderMessage.warning(
                                ErrorKind.ROW_PARSE,
                                "Skipped row with unparsable quantity or price: " + ex.getMessage(),
                                row.getRowNumber()));
                continue;
            }

            String rawType = text(row.get(columns.getTypeColumn()));
            TransactionKind kind = options.classify(rawType);
            if (kind == null) {
                skippedRows.add(
                        new SkippedRow(
                                row.getRowNumber(),
                                ErrorKind.UNRECOGNIZED_TYPE,
                                "Type '" + rawType + "' is neither a buy nor a sell value"));
                messages.add(
                        new LoaderMessage(
                                LoaderMessage.Level.INFO,
                                ErrorKind.UNRECOGNIZED_TYPE,
                                "Ignored row with type '" + rawType + "'",
                                row.getRowNumber()));
                continue;
            }

            Object rawDate = row.get(columns.getDateColumn());
            LocalDateTime date = DateParser.parse(rawDate, options.getInputDateFormat());
            if (date == null) {
                messages.add(
                        LoaderMessage.warning(
                                ErrorKind.DATE_PARSE,
                                "Unparsable date '" + rawDate + "', row kept with an invalid date",
                                row.getRowNumber()));
            }

            String currency =
                    columns.hasCurrencyColumn() ? text(row.get(columns.getCurrencyColumn())) : null;
            transactions.add(
                    new TransactionRecord(
                            row.getRowNumber(),
                            date,
                            text(rawDate),
                            kind,
                            quantity,
                            price,
                            text(row.get(columns.getIdentifierColumn())),
                            currency,
                            extraAttributes(row)));
        }
        if (missingCount > 0) {
            messages.add(
                    0,
                    LoaderMessage.warning(
                            ErrorKind.MISSING_VALUE,
                            missingCount + " row(s) dropped because a selected column was empty",
                            0));
        }
    }

    List<TransactionRecord> getTransactions() {
        return transactions;
    }

    List<SkippedRow> getSkippedRows() {
        return skippedRows;
    }

    List<LoaderMessage> getMessages() {
        return messages;
    }

    private Map<String, String> extraAttributes(RawRecord row) {
        Map<String, String> extras = new LinkedHashMap<>();
        for (String column : options.getExtraColumns()) {
            extras.put(column, text(row.get(column)));
        }
        return extras;
    }

    private static String firstMissing(RawRecord row, List<String> columns) {
        for (String column : columns) {
            if (row.isMissing(column)) {
                return column;
            }
        }
        return null;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString().trim();
    }
}
