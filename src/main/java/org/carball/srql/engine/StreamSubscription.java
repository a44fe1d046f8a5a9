package org.carball.srql.engine;

/**
 * Handle on a live feed. Closing it cancels delivery; closing twice is a no-op.
 */
public interface StreamSubscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
