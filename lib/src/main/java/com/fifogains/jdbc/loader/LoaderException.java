package com.fifogains.jdbc.loader;

/**
 * Checked exception signalling that transactions could not be loaded or that the run was aborted
 * before any matching took place.
 */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
