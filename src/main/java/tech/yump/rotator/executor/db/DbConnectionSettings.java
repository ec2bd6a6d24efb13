package tech.yump.rotator.executor.db;

import java.util.Locale;

/**
 * Resolved connection fields of one database operation.
 */
public record DbConnectionSettings(
        SqlDialect dialect,
        String host,
        int port,
        String database,
        String username,
        String password,
        boolean ssl
) {

    public String jdbcUrl() {
        return dialect.jdbcUrl(host, port, database);
    }

    /**
     * Target description without credentials, for logs and error messages.
     */
    public String describe() {
        return dialect.name().toLowerCase(Locale.ROOT) + "://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "DbConnectionSettings[" + describe() + ", username=" + username + ", password=****, ssl=" + ssl + "]";
    }
}
