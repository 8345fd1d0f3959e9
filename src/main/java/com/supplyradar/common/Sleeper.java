package com.supplyradar.common;

/**
 * Waits between retry attempts. Swapped for a recording fake in tests so no wall-clock time passes.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
