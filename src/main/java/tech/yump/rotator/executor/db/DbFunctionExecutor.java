package tech.yump.rotator.executor.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;
import org.springframework.stereotype.Component;
import tech.yump.rotator.config.RotatorProperties;
import tech.yump.rotator.executor.ExecutorException;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.executor.FunctionExecutor;
import tech.yump.rotator.expression.ExpressionEngine;
import tech.yump.rotator.expression.ResolutionException;
import tech.yump.rotator.rotation.CancellationSignal;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.DbOperation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs one SQL statement over a connection opened for this operation only.
 * <p>
 * Result body: {@code {"rows": [ {column: value, ..}, .. ]}} when the statement returns rows,
 * {@code {"updateCount": n}} otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbFunctionExecutor implements FunctionExecutor<DbOperation> {

    private static final Pattern HOST = Pattern.compile("[A-Za-z0-9._\\-]+|\\[[0-9A-Fa-f:.]+]");
    private static final Pattern DATABASE = Pattern.compile("[A-Za-z0-9_\\-$.]+");

    private final ExpressionEngine expressionEngine;
    private final DataSourceFactory dataSourceFactory;
    private final RotatorProperties properties;

    @Override
    public ExecutorResult execute(DbOperation operation, RotationContext context, CancellationSignal signal) {
        SqlDialect dialect = SqlDialect.of(operation.client());
        DbConnectionSettings settings = resolveSettings(operation, dialect, context);
        String sql = expressionEngine.resolve(operation.query(), context, dialect::encode);

        if (signal.isCancelled()) {
            throw ExecutorException.cancelled(settings.describe());
        }

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSourceFactory.create(settings));
        jdbcTemplate.setExceptionTranslator(new SQLExceptionSubclassTranslator());
        jdbcTemplate.setQueryTimeout((int) properties.db().queryTimeout().toSeconds());

        log.debug("Executing statement on {} as user '{}'", settings.describe(), settings.username());
        log.trace("Statement template: {}", operation.query());
        try {
            JsonNode body = jdbcTemplate.execute((StatementCallback<JsonNode>) statement -> {
                try (CancellationSignal.Registration ignored = signal.onCancel(() -> cancel(statement, settings))) {
                    return run(statement, sql);
                }
            });
            if (signal.isCancelled()) {
                throw ExecutorException.cancelled(settings.describe());
            }
            log.info("Statement completed on {}", settings.describe());
            return ExecutorResult.ofBody(body);
        } catch (CannotGetJdbcConnectionException e) {
            log.warn("Could not connect to {}: {}", settings.describe(), context.redact(rootMessage(e)));
            if (signal.isCancelled()) {
                throw ExecutorException.cancelled(settings.describe());
            }
            throw new ExecutorException("Could not connect to " + settings.describe() + ": "
                    + context.redact(rootMessage(e)), true);
        } catch (DataAccessException e) {
            if (signal.isCancelled()) {
                log.info("Statement on {} was cancelled", settings.describe());
                throw ExecutorException.cancelled(settings.describe());
            }
            log.warn("Statement failed on {}: {}", settings.describe(), context.redact(rootMessage(e)));
            throw new ExecutorException("Statement failed on " + settings.describe() + ": "
                    + context.redact(rootMessage(e)), false);
        }
    }

    private JsonNode run(Statement statement, String sql) throws SQLException {
        if (statement.execute(sql)) {
            try (ResultSet resultSet = statement.getResultSet()) {
                List<Map<String, Object>> rows = new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(resultSet);
                ArrayNode array = JsonNodeFactory.instance.arrayNode(rows.size());
                rows.forEach(row -> array.add(toRowNode(row)));
                ObjectNode body = JsonNodeFactory.instance.objectNode();
                body.set("rows", array);
                return body;
            }
        }
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("updateCount", statement.getUpdateCount());
        return body;
    }

    private DbConnectionSettings resolveSettings(DbOperation operation, SqlDialect dialect, RotationContext context) {
        String host = expressionEngine.resolve(operation.host(), context);
        if (!HOST.matcher(host).matches()) {
            throw new ResolutionException("DB host contains characters that are not allowed in a host name");
        }
        String database = expressionEngine.resolve(operation.database(), context);
        if (!DATABASE.matcher(database).matches()) {
            throw new ResolutionException("DB database name contains characters that are not allowed in a JDBC URL");
        }
        return new DbConnectionSettings(
                dialect,
                host,
                resolvePort(operation, context),
                database,
                expressionEngine.resolve(operation.username(), context),
                expressionEngine.resolve(operation.password(), context),
                resolveSsl(operation, context));
    }

    private int resolvePort(DbOperation operation, RotationContext context) {
        String port = expressionEngine.resolve(operation.port(), context).trim();
        try {
            int value = new BigDecimal(port).intValueExact();
            if (value < 1 || value > 65535) {
                throw new ResolutionException("DB port is out of range: " + value);
            }
            return value;
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ResolutionException("DB port does not resolve to an integer", e);
        }
    }

    private boolean resolveSsl(DbOperation operation, RotationContext context) {
        if (operation.ssl() == null || operation.ssl().isBlank()) {
            return false;
        }
        String ssl = expressionEngine.resolve(operation.ssl(), context).trim().toLowerCase(Locale.ROOT);
        if (!"true".equals(ssl) && !"false".equals(ssl)) {
            throw new ResolutionException("DB ssl flag does not resolve to true or false");
        }
        return Boolean.parseBoolean(ssl);
    }

    private static void cancel(Statement statement, DbConnectionSettings settings) {
        try {
            log.info("Cancelling in-flight statement on {}", settings.describe());
            statement.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel statement on {}: {}", settings.describe(), e.getMessage());
        }
    }

    private static JsonNode toRowNode(Map<String, Object> row) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        row.forEach((column, value) -> node.set(column, toValueNode(value)));
        return node;
    }

    private static JsonNode toValueNode(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value instanceof String text) {
            return TextNode.valueOf(text);
        }
        if (value instanceof Boolean bool) {
            return JsonNodeFactory.instance.booleanNode(bool);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return JsonNodeFactory.instance.numberNode(((Number) value).longValue());
        }
        if (value instanceof BigDecimal decimal) {
            return JsonNodeFactory.instance.numberNode(decimal);
        }
        if (value instanceof BigInteger integer) {
            return JsonNodeFactory.instance.numberNode(integer);
        }
        if (value instanceof Number number) {
            return JsonNodeFactory.instance.numberNode(number.doubleValue());
        }
        return TextNode.valueOf(value.toString());
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
