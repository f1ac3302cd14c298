package de.t14d3.drawer.test;

import de.t14d3.drawer.core.Drawer;
import de.t14d3.drawer.exceptions.TransactionException;
import de.t14d3.drawer.query.Dialect;
import de.t14d3.drawer.query.QueryRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class H2DrawerTest {
    private Drawer drawer;

    @BeforeEach
    void setup() {
        drawer = Drawer.open("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    @AfterEach
    void teardown() {
        if (!drawer.isClosed()) {
            if (drawer.isTransactionActive()) {
                drawer.rollback();
            }
            drawer.close();
        }
    }

    @Test
    void testRoundTrip() {
        assertEquals(Dialect.H2, drawer.dialect());

        drawer.put("k", Map.of("list", List.of(1, 2, 3), "flag", true));
        drawer.put("k", "replaced");
        drawer.put("other", 5);
        drawer.refresh();

        assertEquals("replaced", drawer.get("k"));
        assertEquals(5, drawer.get("other"));
        assertEquals(2, drawer.size());
        assertTrue(drawer.containsKey("other"));

        drawer.remove("other");
        assertFalse(drawer.containsKey("other"));
        assertEquals(1, drawer.batchDelete(List.of("k", "missing")));
        assertTrue(drawer.isEmpty());
    }

    @Test
    void testTransactions() {
        drawer.put("a", 1);

        assertThrows(IllegalStateException.class, () -> drawer.transactional(() -> {
            drawer.put("a", 2);
            throw new IllegalStateException("abort");
        }));
        assertEquals(1, drawer.get("a"));

        drawer.beginTransaction();
        assertThrows(TransactionException.class, drawer::beginTransaction);
        drawer.put("b", 2);
        drawer.commit();
        assertEquals(2, drawer.getFresh("b"));
    }

    @Test
    void testChildTables() {
        Drawer child = drawer.table("orders");
        child.put("o1", "open");
        drawer.put("o1", "root");

        assertEquals("open", child.getFresh("o1"));
        assertEquals("root", drawer.getFresh("o1"));
    }

    @Test
    void testTableNamesFoldToUpperCase() {
        assertEquals("\"USERS\"", Dialect.H2.quoteIdentifier("Users"));
        assertEquals("\"Users\"", Dialect.SQLITE.quoteIdentifier("Users"));

        Drawer mixed = drawer.table("Users");
        Drawer lower = drawer.table("users");
        mixed.put("u1", "alice");

        assertEquals("alice", lower.getFresh("u1"));
        assertEquals(List.of("u1"), lower.keys());
    }

    @Test
    void testQuery() {
        drawer.put("b", 2);
        drawer.put("a", 1);
        drawer.put("c", 3);

        List<Map<String, Object>> rows = drawer.query(QueryRequest.builder()
                .columns("key")
                .orderBy("key")
                .build());
        assertEquals(3, rows.size());
        assertEquals("a", rows.get(0).get("KEY"));
        assertEquals("c", rows.get(2).get("KEY"));

        List<Map<String, Object>> limited = drawer.query(QueryRequest.builder()
                .columns("key")
                .where("\"KEY\" <> ?", "a")
                .orderBy("key DESC")
                .limit(1)
                .build());
        assertEquals("c", limited.get(0).get("KEY"));
    }

    @Test
    void testSqliteHousekeepingIsUnsupported() {
        assertThrows(UnsupportedOperationException.class, () -> drawer.pragma("journal_mode"));
        assertThrows(UnsupportedOperationException.class, () -> drawer.checkpoint());
        assertThrows(UnsupportedOperationException.class, drawer::vacuum);
    }
}
