package com.fifogains.jdbc.loader;

import java.util.Objects;

/**
 * Represents a diagnostic produced while loading transactions. Row-level diagnostics carry the
 * 1-based data row number; table-level ones use {@code 0}.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final ErrorKind kind;
    private final String message;
    private final int rowNumber;

    public LoaderMessage(Level level, ErrorKind kind, String message, int rowNumber) {
        this.level = Objects.requireNonNull(level, "level");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.rowNumber = rowNumber;
    }

    public static LoaderMessage error(ErrorKind kind, String message) {
        return new LoaderMessage(Level.ERROR, kind, message, 0);
    }

    public static LoaderMessage warning(ErrorKind kind, String message, int rowNumber) {
        return new LoaderMessage(Level.WARNING, kind, message, rowNumber);
    }

    public Level getLevel() {
        return level;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    @Override
    public String toString() {
        String location = rowNumber > 0 ? " (row " + rowNumber + ")" : "";
        return level + " " + kind + ": " + message + location;
    }
}
