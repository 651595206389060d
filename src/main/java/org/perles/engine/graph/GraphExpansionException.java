package org.perles.engine.graph;

import org.perles.bql.dsl.BqlException;

/**
 * Thrown when a graph expansion is interrupted or runs out of its time budget.
 */
public class GraphExpansionException extends BqlException {

    public GraphExpansionException(String message) {
        super(message);
    }
}
