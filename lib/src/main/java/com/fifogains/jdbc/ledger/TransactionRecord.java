package com.fifogains.jdbc.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class TransactionRecord {
    public static final String DEFAULT_CURRENCY = "N/A";

    private final int rowNumber;
    private final LocalDateTime date;
    private final String rawDate;
    private final TransactionKind kind;
    private final BigDecimal quantity;
    private final BigDecimal price;
    private final String identifier;
    private final String currency;
    private final Map<String, String> extraAttributes;

    public TransactionRecord(
            int rowNumber,
            LocalDateTime date,
            String rawDate,
            TransactionKind kind,
            BigDecimal quantity,
            BigDecimal price,
            String identifier,
            String currency,
            Map<String, String> extraAttributes) {
        this.rowNumber = rowNumber;
        this.date = date;
        this.rawDate = rawDate;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.quantity = Objects.requireNonNull(quantity, "quantity").abs();
        this.price = Objects.requireNonNull(price, "price");
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.currency = currency != null ? currency : DEFAULT_CURRENCY;
        this.extraAttributes =
                extraAttributes == null || extraAttributes.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(extraAttributes));
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /** Parsed date, or {@code null} when the source value could not be parsed. */
    public LocalDateTime getDate() {
        return date;
    }

    public boolean hasValidDate() {
        return date != null;
    }

    public String getRawDate() {
        return rawDate;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getCurrency() {
        return currency;
    }

    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }
}
