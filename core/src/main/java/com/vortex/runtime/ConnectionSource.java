package com.vortex.runtime;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out JDBC connections. Callers close what they receive.
 */
@FunctionalInterface
public interface ConnectionSource {

    Connection getConnection() throws SQLException;
}
