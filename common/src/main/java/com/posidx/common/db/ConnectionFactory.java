package com.posidx.common.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens connections to the relational store. Callers own and close what they get.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open() throws SQLException;
}
