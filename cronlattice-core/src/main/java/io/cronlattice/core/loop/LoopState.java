package io.cronlattice.core.loop;

public enum LoopState
{
    REGISTERED,
    ARMED,
    CONTENDING,
    EXECUTING,
    SKIPPED,
    REMOVED;

    public boolean isTerminal()
    {
        return this == REMOVED;
    }
}
