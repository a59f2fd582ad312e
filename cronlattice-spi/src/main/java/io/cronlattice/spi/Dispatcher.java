package io.cronlattice.spi;

/**
 * Outbound invocation of the component linked to a job.
 */
public interface Dispatcher
{
    void dispatch(DispatchRequest request)
        throws DispatchException;
}
