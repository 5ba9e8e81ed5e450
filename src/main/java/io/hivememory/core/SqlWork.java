package io.hivememory.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run against the engine's single connection.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection connection) throws SQLException;
}
