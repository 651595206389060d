package org.perles.bql.validation;

import org.perles.bql.dsl.BqlException;

/**
 * Exception thrown when a syntactically valid query breaks the field rules.
 */
public class BqlValidationException extends BqlException {

    private final String field;

    public BqlValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return The field the offending comparison or order term refers to
     */
    public String getField() {
        return field;
    }
}
