package com.taskgraph.engine.lifecycle;

/**
 * A background loop owned by the application: consumers, sweepers, timers.
 * Started once the application is ready and stopped on shutdown, in reverse order.
 */
public interface BackgroundWorker {

    String name();

    void start();

    /**
     * Stop the loop and wait for in-flight work to finish.
     */
    void stop();

    boolean isRunning();
}
