package io.lunacore.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run by {@link LunaDatabase} under its read or write lock.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection connection) throws SQLException;
}
