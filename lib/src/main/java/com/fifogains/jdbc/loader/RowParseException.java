package com.fifogains.jdbc.loader;

/** A single row's quantity or price is not numeric. Recovered by dropping the row. */
public final class RowParseException extends Exception {
    public RowParseException(String message) {
        super(message);
    }

    public RowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
