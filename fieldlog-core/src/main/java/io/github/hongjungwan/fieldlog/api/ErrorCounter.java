package io.github.hongjungwan.fieldlog.api;

/**
 * Counts logged errors.
 *
 * <p>A counter is shared by reference between every logger configured with it and is
 * never reset by a logger. Implementations must tolerate concurrent calls.</p>
 */
@FunctionalInterface
public interface ErrorCounter {

    /**
     * Called once per logged error value.
     *
     * @param error the logged error, or a synthesized {@link FatalLogException} for fatal calls
     */
    void inc(Throwable error);
}
