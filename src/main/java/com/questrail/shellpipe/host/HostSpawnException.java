package com.questrail.shellpipe.host;

/**
 * The command host could not be started.
 */
public final class HostSpawnException extends Exception
{
    public HostSpawnException(String message) {
        super(message);
    }

    public HostSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
