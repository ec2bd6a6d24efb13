package tech.yump.rotator.executor.db;

import tech.yump.rotator.template.DbClient;

import java.time.Duration;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Dialect-specific connection setup and value quoting for database operations.
 * <p>
 * {@link #encode(String, String)} places a resolved value into a query by looking at the raw
 * template text before the token: inside an identifier quote the value is escaped as an
 * identifier, inside a string literal as a literal, and outside any quote only plain words
 * ({@code [A-Za-z0-9_]+}) are accepted.
 */
public enum SqlDialect {

    POSTGRES("org.postgresql.Driver") {
        @Override
        public String jdbcUrl(String host, int port, String database) {
            return "jdbc:postgresql://" + host + ":" + port + "/" + database;
        }

        @Override
        public Properties connectionProperties(boolean ssl, Duration connectTimeout, Duration queryTimeout) {
            Properties properties = new Properties();
            properties.setProperty("connectTimeout", String.valueOf(connectTimeout.toSeconds()));
            properties.setProperty("socketTimeout", String.valueOf(queryTimeout.plus(SOCKET_GRACE).toSeconds()));
            properties.setProperty("sslmode", ssl ? "require" : "disable");
            properties.setProperty("ApplicationName", APPLICATION_NAME);
            return properties;
        }

        @Override
        QuoteContext quoteContext(String precedingTemplate) {
            QuoteContext context = QuoteContext.NONE;
            for (int i = 0; i < precedingTemplate.length(); i++) {
                char c = precedingTemplate.charAt(i);
                switch (context) {
                    case NONE -> {
                        if (c == '\'') {
                            context = QuoteContext.LITERAL;
                        } else if (c == '"') {
                            context = QuoteContext.IDENTIFIER;
                        }
                    }
                    case LITERAL -> {
                        if (c == '\'') {
                            context = QuoteContext.NONE;
                        }
                    }
                    case IDENTIFIER -> {
                        if (c == '"') {
                            context = QuoteContext.NONE;
                        }
                    }
                }
            }
            return context;
        }

        @Override
        String escapeIdentifier(String value) {
            return value.replace("\"", "\"\"");
        }

        @Override
        String escapeLiteral(String value, String precedingTemplate) {
            return value.replace("'", "''");
        }
    },

    MYSQL("com.mysql.cj.jdbc.Driver") {
        @Override
        public String jdbcUrl(String host, int port, String database) {
            return "jdbc:mysql://" + host + ":" + port + "/" + database;
        }

        @Override
        public Properties connectionProperties(boolean ssl, Duration connectTimeout, Duration queryTimeout) {
            Properties properties = new Properties();
            properties.setProperty("connectTimeout", String.valueOf(connectTimeout.toMillis()));
            properties.setProperty("socketTimeout", String.valueOf(queryTimeout.plus(SOCKET_GRACE).toMillis()));
            properties.setProperty("sslMode", ssl ? "REQUIRED" : "DISABLED");
            // caching_sha2_password over a plain connection needs the server key.
            properties.setProperty("allowPublicKeyRetrieval", String.valueOf(!ssl));
            properties.setProperty("connectionAttributes", "program_name:" + APPLICATION_NAME);
            return properties;
        }

        @Override
        QuoteContext quoteContext(String precedingTemplate) {
            return scan(precedingTemplate).context();
        }

        /**
         * Doubles the enclosing quote, which reads the same with and without {@code NO_BACKSLASH_ESCAPES}.
         * Backslashes do not, so they are refused.
         */
        @Override
        String escapeLiteral(String value, String precedingTemplate) {
            if (value.indexOf('\\') >= 0) {
                throw new IllegalArgumentException("backslashes are not allowed in MySQL string values");
            }
            String quote = String.valueOf(scan(precedingTemplate).literalQuote());
            return value.replace(quote, quote + quote);
        }

        private MySqlPosition scan(String precedingTemplate) {
            QuoteContext context = QuoteContext.NONE;
            char literalQuote = 0;
            for (int i = 0; i < precedingTemplate.length(); i++) {
                char c = precedingTemplate.charAt(i);
                switch (context) {
                    case NONE -> {
                        if (c == '\'' || c == '"') {
                            context = QuoteContext.LITERAL;
                            literalQuote = c;
                        } else if (c == '`') {
                            context = QuoteContext.IDENTIFIER;
                        }
                    }
                    case LITERAL -> {
                        if (c == '\\') {
                            i++;
                        } else if (c == literalQuote) {
                            context = QuoteContext.NONE;
                        }
                    }
                    case IDENTIFIER -> {
                        if (c == '`') {
                            context = QuoteContext.NONE;
                        }
                    }
                }
            }
            return new MySqlPosition(context, literalQuote);
        }

        @Override
        String escapeIdentifier(String value) {
            return value.replace("`", "``");
        }
    };

    static final String APPLICATION_NAME = "lite-rotator";
    private static final Duration SOCKET_GRACE = Duration.ofSeconds(5);
    private static final Pattern BARE_WORD = Pattern.compile("[A-Za-z0-9_]+");

    private final String driverClassName;

    SqlDialect(String driverClassName) {
        this.driverClassName = driverClassName;
    }

    public static SqlDialect of(DbClient client) {
        return switch (client) {
            case POSTGRES -> POSTGRES;
            case MYSQL -> MYSQL;
        };
    }

    public String driverClassName() {
        return driverClassName;
    }

    public abstract String jdbcUrl(String host, int port, String database);

    /**
     * Driver properties bounding connect and socket time, and selecting TLS.
     */
    public abstract Properties connectionProperties(boolean ssl, Duration connectTimeout, Duration queryTimeout);

    abstract QuoteContext quoteContext(String precedingTemplate);

    abstract String escapeIdentifier(String value);

    abstract String escapeLiteral(String value, String precedingTemplate);

    /**
     * Encodes a resolved value for its position in the query template.
     *
     * @throws IllegalArgumentException if the value cannot be placed safely. The message never
     *                                  contains the value.
     */
    public String encode(String value, String precedingTemplate) {
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("NUL characters are not allowed in SQL values");
        }
        return switch (quoteContext(precedingTemplate)) {
            case IDENTIFIER -> escapeIdentifier(value);
            case LITERAL -> escapeLiteral(value, precedingTemplate);
            case NONE -> {
                if (!BARE_WORD.matcher(value).matches()) {
                    throw new IllegalArgumentException("unquoted SQL values must be plain words [A-Za-z0-9_]; quote the token in the template");
                }
                yield value;
            }
        };
    }

    private record MySqlPosition(QuoteContext context, char literalQuote) {
    }

    enum QuoteContext {
        NONE,
        IDENTIFIER,
        LITERAL
    }
}
