package com.commandlab.engine.host;

/**
 * Handle for cancelling a host event subscription.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
