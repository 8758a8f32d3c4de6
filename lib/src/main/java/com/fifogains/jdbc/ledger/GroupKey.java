package com.fifogains.jdbc.ledger;

import java.util.Objects;

/** Partition key for FIFO matching: lots are only ever matched within one identifier and currency. */
public record GroupKey(String identifier, String currency) {

    public GroupKey {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(currency, "currency");
    }

    public static GroupKey of(TransactionRecord transaction) {
        return new GroupKey(transaction.getIdentifier(), transaction.getCurrency());
    }
}
