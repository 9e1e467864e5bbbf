package com.bftchain.timer;

import java.util.function.Consumer;

public interface RoundTimer {
    /**
     * Schedules a step timeout. Any timeout still pending is cancelled first,
     * at most one is ever outstanding.
     */
    void schedule(TimeoutInfo timeout);

    /**
     * Cancels the pending timeout, if any
     */
    void cancel();

    /**
     * Sets the handler called when a timeout expires
     */
    void setTimeoutHandler(Consumer<TimeoutInfo> handler);

    /**
     * Cancels the pending timeout and releases threads
     */
    void shutdown();
}
