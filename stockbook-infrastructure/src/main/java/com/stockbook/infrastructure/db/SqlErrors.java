package com.stockbook.infrastructure.db;

import com.stockbook.application.persistence.DuplicateKeyException;
import com.stockbook.application.persistence.PersistenceException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/** Maps driver exceptions onto the persistence exception hierarchy. */
public final class SqlErrors {

    private SqlErrors() {}

    public static PersistenceException translate(String operation, SQLException e) {
        if (isUniqueViolation(e)) {
            return new DuplicateKeyException(operation + ": duplicate key (" + e.getMessage() + ")", e);
        }
        return new PersistenceException(operation + " failed: " + e.getMessage(), e);
    }

    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException se) {
            SQLiteErrorCode code = se.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        String msg = e.getMessage();
        return msg != null && msg.contains("UNIQUE constraint failed");
    }
}
