package de.t14d3.drawer.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run against a borrowed connection.
 */
@FunctionalInterface
public interface SqlWork<T> {
    T run(Connection connection) throws SQLException;
}
