package io.launchmanager.server;

import io.launchmanager.command.CommandRegistry;
import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.process.ProcessTable;

/**
 * Handle given to every command. Commands reach the process table and the registry through it
 * instead of through global state.
 */
public interface Supervisor {
    LaunchManagerConfig config();

    ProcessTable processes();

    CommandRegistry commands();

    /**
     * Graceful termination, escalated to a forced kill after the configured timeout. The entry is
     * removed from the table whatever happens.
     *
     * @throws io.launchmanager.process.ProcessNotFoundException if no such process is registered
     */
    void stopProcess(String name);

    /**
     * Stops every managed process.
     *
     * @return how many were stopped
     */
    int stopAll();

    void requestShutdown();

    boolean isRunning();
}
