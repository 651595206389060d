package org.perles.engine.execution;

import org.perles.bql.dsl.BqlException;

import java.util.Objects;

/**
 * Exception thrown when executing a BQL query fails. The stage names the step that failed.
 */
public class BqlExecutionException extends BqlException {

    /**
     * Execution steps, in the order they run.
     */
    public enum Stage {
        PARSE("parse error"),
        VALIDATE("validation error"),
        BASE_QUERY("query error"),
        LOAD_DEPENDENCIES("load dependencies"),
        LOAD_LABELS("load labels"),
        LOAD_COMMENT_COUNTS("load comment counts"),
        LOAD_GRAPH("load dependency graph"),
        EXPAND("expand");

        private final String prefix;

        Stage(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final Stage stage;

    public BqlExecutionException(Stage stage, Throwable cause) {
        super(Objects.requireNonNull(stage, "Stage cannot be null").prefix() + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
