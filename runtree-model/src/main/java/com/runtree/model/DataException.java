package com.runtree.model;

/**
 * User-facing "data error": the report or dictionary data given to runtree is invalid.
 * Parsing, configuration and JSON loading all fail fast with this type (or a subclass);
 * no partial result is returned to the caller.
 */
public class DataException extends RuntimeException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
