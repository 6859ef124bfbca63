package com.umitunal.sendlater.scheduler;

/**
 * Receives scheduler events synchronously on the thread that caused them.
 * Implementations should return quickly and must not block.
 */
@FunctionalInterface
public interface SchedulerListener {

    void onEvent(SchedulerEvent event);
}
