package com.questrail.shellpipe.host;

import java.util.Objects;
import java.util.Optional;

/**
 * Alternate account under which the command host is launched.
 *
 * @param username account name
 * @param password account password; never logged
 * @param domain account domain; only meaningful on Windows
 */
public record HostCredentials(String username, String password, Optional<String> domain) {

    public HostCredentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(domain, "domain");
        if (username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
    }

    public HostCredentials(String username, String password) {
        this(username, password, Optional.empty());
    }

    @Override
    public String toString() {
        return "HostCredentials[username=" + username + ", domain=" + domain.orElse("-") + "]";
    }
}
