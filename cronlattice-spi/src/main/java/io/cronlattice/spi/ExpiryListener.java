package io.cronlattice.spi;

public interface ExpiryListener
{
    void onExpiry(TriggerMarker marker);
}
