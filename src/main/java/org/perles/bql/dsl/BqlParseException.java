package org.perles.bql.dsl;

/**
 * Exception thrown when BQL lexing or parsing fails.
 * Carries the offset of the offending token for editor integration.
 */
public class BqlParseException extends BqlException {

    private final int position;
    private final String found;

    public BqlParseException(String message, int position, String found) {
        super(message);
        this.position = position;
        this.found = found;
    }

    public BqlParseException(String message, Token token) {
        this(message, token.position(), token.literal());
    }

    /**
     * @return The 0-based offset of the offending token
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return The literal of the offending token, empty at end of input
     */
    public String getFound() {
        return found;
    }
}
