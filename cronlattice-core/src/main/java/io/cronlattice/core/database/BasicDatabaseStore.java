package io.cronlattice.core.database;

import java.sql.SQLException;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import io.cronlattice.spi.SubstrateException;

/**
 * Runs statements of a substrate table and turns database errors into
 * {@link SubstrateException}s.
 */
abstract class BasicDatabaseStore
{
    protected final Jdbi dbi;

    protected BasicDatabaseStore(Jdbi dbi)
    {
        this.dbi = dbi;
    }

    protected <T> T autoCommit(HandleCallback<T, RuntimeException> action)
    {
        try {
            return dbi.withHandle(action);
        }
        catch (JdbiException ex) {
            throw new SubstrateException("Database operation failed", ex);
        }
    }

    /**
     * Runs an insert and returns false instead of failing when the row
     * already exists.
     */
    protected boolean insertUnlessConflict(HandleCallback<Integer, RuntimeException> insert)
    {
        try {
            return dbi.inTransaction(insert) > 0;
        }
        catch (UnableToExecuteStatementException ex) {
            if (ex.getCause() instanceof SQLException && isConflictException((SQLException) ex.getCause())) {
                return false;
            }
            throw new SubstrateException("Database insert failed", ex);
        }
        catch (JdbiException ex) {
            throw new SubstrateException("Database insert failed", ex);
        }
    }

    static boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }
}
