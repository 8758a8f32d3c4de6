package com.fifogains.jdbc.loader;

import com.fifogains.jdbc.ledger.TransactionKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable run configuration: column mapping, buy/sell classification, rounding and date formats.
 *
 * <p>Options can be assembled with {@link #builder()} or read from {@link Properties} (JDBC URL
 * parameters, connection info or a properties file) with {@link #fromProperties(Properties)}.
 * List-valued properties are comma separated.
 */
public final class FifoOptions {
    public static final String DATE_COLUMN = "dateColumn";
    public static final String TYPE_COLUMN = "typeColumn";
    public static final String QUANTITY_COLUMN = "quantityColumn";
    public static final String PRICE_COLUMN = "priceColumn";
    public static final String IDENTIFIER_COLUMN = "identifierColumn";
    public static final String CURRENCY_COLUMN = "currencyColumn";
    public static final String EXTRA_COLUMNS = "extraColumns";
    public static final String BUY_VALUES = "buy";
    public static final String SELL_VALUES = "sell";
    public static final String ROUND_GAINS = "roundGains";
    public static final String INPUT_DATE_FORMAT = "inputDateFormat";
    public static final String OUTPUT_DATE_FORMAT = "outputDateFormat";

    public static final String DEFAULT_OUTPUT_DATE_FORMAT = "yyyy-MM-dd";

    /** Every property key read by {@link #fromProperties(Properties)}. */
    public static final List<String> PROPERTY_KEYS =
            List.of(
                    DATE_COLUMN,
                    TYPE_COLUMN,
                    QUANTITY_COLUMN,
                    PRICE_COLUMN,
                    IDENTIFIER_COLUMN,
                    CURRENCY_COLUMN,
                    EXTRA_COLUMNS,
                    BUY_VALUES,
                    SELL_VALUES,
                    ROUND_GAINS,
                    INPUT_DATE_FORMAT,
                    OUTPUT_DATE_FORMAT);

    private final ColumnMapping columns;
    private final Set<String> buyValues;
    private final Set<String> sellValues;
    private final List<String> extraColumns;
    private final boolean roundGains;
    private final String inputDateFormat;
    private final String outputDateFormat;

    private FifoOptions(Builder builder) {
        this.columns =
                new ColumnMapping(
                        builder.dateColumn,
                        builder.typeColumn,
                        builder.quantityColumn,
                        builder.priceColumn,
                        builder.identifierColumn,
                        builder.currencyColumn);
        this.buyValues = Collections.unmodifiableSet(new LinkedHashSet<>(builder.buyValues));
        this.sellValues = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sellValues));
        this.extraColumns = List.copyOf(new LinkedHashSet<>(builder.extraColumns));
        this.roundGains = builder.roundGains;
        this.inputDateFormat =
                builder.inputDateFormat == null || builder.inputDateFormat.isBlank()
                        ? null
                        : builder.inputDateFormat;
        this.outputDateFormat =
                builder.outputDateFormat == null || builder.outputDateFormat.isBlank()
                        ? DEFAULT_OUTPUT_DATE_FORMAT
                        : builder.outputDateFormat;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FifoOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder =
                builder()
                        .dateColumn(properties.getProperty(DATE_COLUMN))
                        .typeColumn(properties.getProperty(TYPE_COLUMN))
                        .quantityColumn(properties.getProperty(QUANTITY_COLUMN))
                        .priceColumn(properties.getProperty(PRICE_COLUMN))
                        .identifierColumn(properties.getProperty(IDENTIFIER_COLUMN))
                        .currencyColumn(properties.getProperty(CURRENCY_COLUMN))
                        .extraColumns(splitList(properties.getProperty(EXTRA_COLUMNS)))
                        .buyValues(splitList(properties.getProperty(BUY_VALUES)))
                        .sellValues(splitList(properties.getProperty(SELL_VALUES)))
                        .inputDateFormat(properties.getProperty(INPUT_DATE_FORMAT))
                        .outputDateFormat(properties.getProperty(OUTPUT_DATE_FORMAT));
        String round = properties.getProperty(ROUND_GAINS);
        if (round != null && !round.isBlank()) {
            builder.roundGains(Boolean.parseBoolean(round.trim().toLowerCase(Locale.ROOT)));
        }
        return builder.build();
    }

    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    /**
     * Classifies a raw type value. Buy values win when a value was selected for both sides.
     *
     * @return the kind, or {@code null} when the value is neither a buy nor a sell value
     */
    public TransactionKind classify(String rawType) {
        if (rawType == null) {
            return null;
        }
        String value = rawType.trim();
        if (buyValues.contains(value)) {
            return TransactionKind.BUY;
        }
        if (sellValues.contains(value)) {
            return TransactionKind.SELL;
        }
        return null;
    }

    public ColumnMapping getColumns() {
        return columns;
    }

    public boolean hasCurrencyColumn() {
        return columns.hasCurrencyColumn();
    }

    /** Every column that must hold a value for a row to be used, in reporting order. */
    public List<String> requiredColumns() {
        List<String> required = new ArrayList<>(columns.mappedColumns());
        for (String extra : extraColumns) {
            if (!required.contains(extra)) {
                required.add(extra);
            }
        }
        return required;
    }

    public Set<String> getBuyValues() {
        return buyValues;
    }

    public Set<String> getSellValues() {
        return sellValues;
    }

    public List<String> getExtraColumns() {
        return extraColumns;
    }

    public boolean isRoundGains() {
        return roundGains;
    }

    /** Explicit input pattern, or {@code null} to auto-detect. */
    public String getInputDateFormat() {
        return inputDateFormat;
    }

    public String getOutputDateFormat() {
        return outputDateFormat;
    }

    public static final class Builder {
        private String dateColumn;
        private String typeColumn;
        private String quantityColumn;
        private String priceColumn;
        private String identifierColumn;
        private String currencyColumn;
        private final List<String> extraColumns = new ArrayList<>();
        private final Set<String> buyValues = new LinkedHashSet<>();
        private final Set<String> sellValues = new LinkedHashSet<>();
        private boolean roundGains = true;
        private String inputDateFormat;
        private String outputDateFormat = DEFAULT_OUTPUT_DATE_FORMAT;

        private Builder() {}

        public Builder dateColumn(String column) {
            this.dateColumn = column;
            return this;
        }

        public Builder typeColumn(String column) {
            this.typeColumn = column;
            return this;
        }

        public Builder quantityColumn(String column) {
            this.quantityColumn = column;
            return this;
        }

        public Builder priceColumn(String column) {
            this.priceColumn = column;
            return this;
        }

        public Builder identifierColumn(String column) {
            this.identifierColumn = column;
            return this;
        }

        public Builder currencyColumn(String column) {
            this.currencyColumn = column;
            return this;
        }

        public Builder extraColumns(Collection<String> columns) {
            this.extraColumns.addAll(columns);
            return this;
        }

        public Builder buyValues(Collection<String> values) {
            addTrimmed(buyValues, values);
            return this;
        }

        public Builder sellValues(Collection<String> values) {
            addTrimmed(sellValues, values);
            return this;
        }

        public Builder roundGains(boolean round) {
            this.roundGains = round;
            return this;
        }

        public Builder inputDateFormat(String pattern) {
            this.inputDateFormat = pattern;
            return this;
        }

        public Builder outputDateFormat(String pattern) {
            this.outputDateFormat = pattern;
            return this;
        }

        public FifoOptions build() {
            return new FifoOptions(this);
        }

        private static void addTrimmed(Set<String> target, Collection<String> values) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    target.add(value.trim());
                }
            }
        }
    }
}
