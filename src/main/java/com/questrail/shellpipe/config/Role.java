package com.questrail.shellpipe.config;

/**
 * Which end of the channel this process runs.
 */
public enum Role
{
    /** Hosts the command interpreter and waits for a peer. */
    SERVER,

    /** Connects to a server and relays the local console. */
    CLIENT
}
