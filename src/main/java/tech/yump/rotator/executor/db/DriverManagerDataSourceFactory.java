package tech.yump.rotator.executor.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;
import tech.yump.rotator.config.RotatorProperties;

import javax.sql.DataSource;

/**
 * Non-pooled data sources: every {@code getConnection()} opens a new physical connection,
 * released when the statement completes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverManagerDataSourceFactory implements DataSourceFactory {

    private final RotatorProperties properties;

    @Override
    public DataSource create(DbConnectionSettings settings) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                settings.jdbcUrl(), settings.username(), settings.password());
        dataSource.setDriverClassName(settings.dialect().driverClassName());
        dataSource.setConnectionProperties(settings.dialect().connectionProperties(
                settings.ssl(),
                properties.db().connectTimeout(),
                properties.db().queryTimeout()));
        log.debug("Prepared short-lived data source for {}", settings.describe());
        return dataSource;
    }
}
