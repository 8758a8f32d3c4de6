package com.fifogains.jdbc.ledger;

/** Direction of a transaction. Derived from the type column, never from the quantity sign. */
public enum TransactionKind {
    BUY,
    SELL
}
