package io.cronlattice.spi;

/**
 * A transient failure of the coordination substrate. Callers may retry.
 */
public class SubstrateException
        extends RuntimeException
{
    public SubstrateException(String message)
    {
        super(message);
    }

    public SubstrateException(Throwable cause)
    {
        super(cause);
    }

    public SubstrateException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
