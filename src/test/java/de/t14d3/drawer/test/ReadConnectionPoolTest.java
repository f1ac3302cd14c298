package de.t14d3.drawer.test;

import de.t14d3.drawer.connection.ReadConnectionPool;
import de.t14d3.drawer.connection.SqlExecutor;
import de.t14d3.drawer.core.Drawer;
import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.query.Dialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ReadConnectionPoolTest {
    @TempDir
    Path tempDir;

    @Test
    void testCloseAttemptsEveryConnection() throws SQLException {
        Connection first = mock(Connection.class);
        Connection failing = mock(Connection.class);
        Connection last = mock(Connection.class);
        SQLException boom = new SQLException("boom");
        doThrow(boom).when(failing).close();

        ReadConnectionPool pool = new ReadConnectionPool(List.of(first, failing, last));
        DatabaseException e = assertThrows(DatabaseException.class, pool::close);

        assertTrue(e.getMessage().contains("1 of 3"));
        assertEquals(1, e.getSuppressed().length);
        assertSame(boom, e.getSuppressed()[0]);
        verify(first).close();
        verify(failing).close();
        verify(last).close();
        assertTrue(pool.isClosed());

        assertDoesNotThrow(pool::close);
        verify(first, times(1)).close();
    }

    @Test
    void testClosedPoolRejectsWork() {
        ReadConnectionPool pool = new ReadConnectionPool(List.of(mock(Connection.class)));
        pool.close();

        assertThrows(ClosedException.class, () -> pool.withConnection(connection -> 1));
    }

    @Test
    void testEmptyPoolIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ReadConnectionPool(List.of()));
    }

    @Test
    void testConnectionIsReturnedAfterFailure() {
        ReadConnectionPool pool = new ReadConnectionPool(List.of(mock(Connection.class), mock(Connection.class)));

        assertThrows(DatabaseException.class, () -> pool.withConnection(connection -> {
            throw new SQLException("query failed");
        }));
        assertEquals(2, pool.available());
        assertEquals("ok", pool.withConnection(connection -> "ok"));
        assertEquals(2, pool.available());
    }

    @Test
    void testSqliteConnectionsAreReadOnly() {
        String path = tempDir.resolve("pool.db").toString();
        try (Drawer drawer = Drawer.open(path)) {
            drawer.put("k", "v");

            try (ReadConnectionPool pool = ReadConnectionPool.open("jdbc:sqlite:" + path, Dialect.SQLITE, 2, null)) {
                assertEquals(2, pool.size());
                List<List<Object>> rows = pool.withConnection(connection ->
                        SqlExecutor.queryRows(connection, "SELECT \"key\" FROM \"data\"", List.of()));
                assertEquals(List.of(List.of("k")), rows);

                assertThrows(DatabaseException.class, () -> pool.withConnection(connection ->
                        SqlExecutor.executeUpdate(connection, "DELETE FROM \"data\"", List.of())));
            }
            assertEquals(1, drawer.size());
        }
    }

    @Test
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class,
                () -> ReadConnectionPool.open("jdbc:sqlite:unused.db", Dialect.SQLITE, 0, null));
    }
}
