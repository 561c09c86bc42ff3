package com.stockbook.infrastructure.db;

import java.sql.Connection;
import java.sql.SQLException;

/** JDBC work run against a connection someone else owns. */
@FunctionalInterface
public interface SqlWork<T> {
    T apply(Connection c) throws SQLException;
}
