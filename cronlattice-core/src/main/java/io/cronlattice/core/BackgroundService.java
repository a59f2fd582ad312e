package io.cronlattice.core;

/**
 * A component with threads or loops that run while the embed is started.
 *
 * Services are started in binding order and shut down in reverse order.
 */
public interface BackgroundService
{
    void start();

    void shutdown();
}
