package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.exception.ProcessStartException;

/**
 * Starts a process on a named machine.
 */
@FunctionalInterface
public interface RemoteProcessLauncher {

    /**
     * @param spec what to run, where, and with which environment and container
     * @return handle owned by the caller until registered
     * @throws ProcessStartException if the process could not be started
     */
    RemoteProcessHandle start(LaunchSpec spec);
}
