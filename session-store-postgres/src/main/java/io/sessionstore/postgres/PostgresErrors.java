package io.sessionstore.postgres;

import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

enum PostgresErrors {
    ;

    static boolean isUniqueViolation(SQLException e, String constraint) {
        if (!PSQLState.UNIQUE_VIOLATION.getState().equals(e.getSQLState())) {
            return false;
        }
        if (e instanceof PSQLException) {
            ServerErrorMessage serverError = ((PSQLException) e).getServerErrorMessage();
            if (serverError != null && serverError.getConstraint() != null) {
                return constraint.equals(serverError.getConstraint());
            }
        }
        return true;
    }
}
