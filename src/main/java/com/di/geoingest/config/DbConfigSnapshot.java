package com.di.geoingest.config;

import java.io.Serializable;

/**
 * Connection settings for one relational source. {@link #toString()} never prints the password.
 */
public record DbConfigSnapshot(String host, int port, String database, String username, String password,
                               int maximumPoolSize, long connectionTimeoutMs) implements Serializable {

    public static final int DEFAULT_PORT = 5432;

    public static DbConfigSnapshot of(String host, int port, String database, String username, String password) {
        return new DbConfigSnapshot(host, port > 0 ? port : DEFAULT_PORT, database, username, password, 2, 30_000L);
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /** Identifies the source in the ledger without credentials. */
    public String displayUrl() {
        return "postgresql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "DbConfigSnapshot[" + displayUrl() + ", user=" + username + "]";
    }
}
