package com.fifogains.jdbc.loader;

/** The source table does not have the columns or rows needed to run at all. */
public final class SchemaException extends LoaderException {
    public SchemaException(String message) {
        super(message);
    }
}
