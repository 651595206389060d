package org.perles.bql.dsl;

/**
 * Base class of every error raised while parsing, validating or executing a BQL query.
 */
public class BqlException extends RuntimeException {

    public BqlException(String message) {
        super(message);
    }

    public BqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
