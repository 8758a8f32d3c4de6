package com.fifogains.jdbc.loader;

/** The options cannot drive a computation, e.g. no buy or no sell values were selected. */
public final class ConfigException extends LoaderException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
