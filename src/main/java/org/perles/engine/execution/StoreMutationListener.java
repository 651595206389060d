package org.perles.engine.execution;

/**
 * Notified after the issue store changes, so cached reads can be dropped.
 */
@FunctionalInterface
public interface StoreMutationListener {

    void onStoreMutated();
}
