package tech.yump.rotator.executor.db;

import javax.sql.DataSource;

/**
 * Creates a data source for a single database operation. Each connection obtained from it
 * is closed when the operation finishes.
 */
public interface DataSourceFactory {

    DataSource create(DbConnectionSettings settings);
}
