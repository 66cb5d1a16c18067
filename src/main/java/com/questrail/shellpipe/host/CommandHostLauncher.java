package com.questrail.shellpipe.host;

/**
 * Starts a fresh {@link CommandHost} for each server session.
 */
@FunctionalInterface
public interface CommandHostLauncher
{
    /**
     * @return a started command host
     * @throws HostSpawnException if the host cannot be started; the server
     *         treats this as fatal and stops
     */
    CommandHost launch() throws HostSpawnException;
}
