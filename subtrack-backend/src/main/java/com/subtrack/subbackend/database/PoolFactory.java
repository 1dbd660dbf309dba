package com.subtrack.subbackend.database;

import java.sql.SQLException;

@FunctionalInterface
public interface PoolFactory {

    ConnectionPool create(ConnectionDescriptor descriptor, int maxConnections) throws SQLException;
}
