package de.t14d3.drawer.test;

import de.t14d3.drawer.async.AsyncDrawer;
import de.t14d3.drawer.core.Drawer;
import de.t14d3.drawer.core.DrawerOptions;
import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.exceptions.TransactionException;
import de.t14d3.drawer.query.QueryRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AsyncDrawerTest {
    @TempDir
    Path tempDir;

    private AsyncDrawer async;

    private AsyncDrawer open(DrawerOptions options) {
        async = AsyncDrawer.open(dbPath(), options);
        return async;
    }

    private String dbPath() {
        return tempDir.resolve("async.db").toString();
    }

    @AfterEach
    void teardown() {
        if (async != null && !async.isClosed()) {
            async.close();
        }
    }

    @Test
    void testBasicOperations() {
        open(DrawerOptions.defaults());

        async.put("k", "v").join();
        assertEquals("v", async.get("k").join());
        assertTrue(async.containsKey("k").join());
        assertEquals(1, async.size().join());
        assertEquals("fallback", async.get("missing", "fallback").join());

        async.batchUpdate(Map.of("a", 1, "b", 2)).join();
        assertEquals(2, async.batchDelete(List.of("a", "b", "zzz")).join());
        assertEquals("v", async.pop("k").join());
        assertTrue(async.keys().join().isEmpty());
    }

    @Test
    void testFailuresCompleteExceptionally() {
        open(DrawerOptions.defaults());

        CompletionException missing = assertThrows(CompletionException.class, () -> async.get("missing").join());
        assertInstanceOf(NoSuchElementException.class, missing.getCause());

        CompletionException commit = assertThrows(CompletionException.class, () -> async.commit().join());
        assertInstanceOf(TransactionException.class, commit.getCause());
    }

    @Test
    void testCheckedFailureInTransaction() {
        open(DrawerOptions.defaults());
        IOException failure = new IOException("boom");

        CompletionException thrown = assertThrows(CompletionException.class, () -> async.inTransaction(() -> {
            async.drawer().put("k", 1);
            throw failure;
        }).join());

        assertSame(failure, thrown.getCause());
        assertFalse(async.containsKey("k").join());
        assertFalse(async.isTransactionActive().join());
    }

    @Test
    void testWorkRunsOnNamedWorkerThreads() {
        open(DrawerOptions.builder().threadNamePrefix("kv").workerCount(2).build());

        String name = async.inTransaction(() -> Thread.currentThread().getName()).join();
        assertTrue(name.startsWith("kv-worker-"), name);
    }

    @Test
    void testReadPoolServesQueries() {
        open(DrawerOptions.builder().readPoolSize(2).build());
        assertTrue(async.hasReadPool());

        async.put("a", 1).join();
        async.put("b", 2).join();

        List<Map<String, Object>> rows = async.query(QueryRequest.builder()
                .columns("key")
                .orderBy("key")
                .build()).join();
        assertEquals(List.of(Map.of("key", "a"), Map.of("key", "b")), rows);

        List<Object> count = async.fetchOne("SELECT COUNT(*) FROM \"data\"").join();
        assertEquals(2, ((Number) count.get(0)).intValue());
        assertEquals(2, async.fetchAll("SELECT \"key\" FROM \"data\"").join().size());
    }

    @Test
    void testReadPoolDoesNotSeeUncommittedWrites() {
        open(DrawerOptions.builder().readPoolSize(1).build());
        Drawer drawer = async.drawer();

        drawer.beginTransaction();
        drawer.put("pending", true);
        List<Object> count = async.fetchOne("SELECT COUNT(*) FROM \"data\"").join();
        assertEquals(0, ((Number) count.get(0)).intValue());
        drawer.commit();

        count = async.fetchOne("SELECT COUNT(*) FROM \"data\"").join();
        assertEquals(1, ((Number) count.get(0)).intValue());
    }

    @Test
    void testReadPoolRejectsWrites() {
        open(DrawerOptions.builder().readPoolSize(1).build());
        async.put("k", 1).join();

        CompletionException e = assertThrows(CompletionException.class,
                () -> async.fetchAll("DELETE FROM \"data\"").join());
        assertInstanceOf(DatabaseException.class, e.getCause());
        assertEquals(1, async.size().join());
    }

    @Test
    void testReadPoolNeedsFileDatabase() {
        assertThrows(IllegalArgumentException.class,
                () -> AsyncDrawer.open(":memory:", DrawerOptions.builder().readPoolSize(2).build()));
    }

    @Test
    void testChildrenShareWorkersAndReadPool() {
        open(DrawerOptions.builder().readPoolSize(1).threadNamePrefix("shared").build());
        AsyncDrawer child = async.table("orders");

        assertTrue(child.hasReadPool());
        child.put("o1", "open").join();
        String name = child.inTransaction(() -> Thread.currentThread().getName()).join();
        assertTrue(name.startsWith("shared-worker-"), name);

        child.close();
        assertTrue(child.isClosed());
        CompletionException e = assertThrows(CompletionException.class, () -> child.get("o1").join());
        assertInstanceOf(ClosedException.class, e.getCause());

        assertFalse(async.isClosed());
        assertEquals("open", async.table("orders").get("o1").join());
    }

    @Test
    void testCloseDrainsQueuedWork() {
        open(DrawerOptions.builder().workerCount(1).build());
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            writes.add(async.put("k" + i, i));
        }

        async.close();

        writes.forEach(f -> assertTrue(f.isDone() && !f.isCompletedExceptionally()));
        try (Drawer reopened = Drawer.open(dbPath())) {
            assertEquals(20, reopened.size());
        }
    }

    @Test
    void testClosedDrawerReturnsFailedFutures() {
        open(DrawerOptions.defaults());
        async.close();
        assertDoesNotThrow(async::close);

        CompletableFuture<Object> future = async.get("k");
        assertTrue(future.isCompletedExceptionally());
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(ClosedException.class, e.getCause());
        assertThrows(ClosedException.class, () -> async.table("other"));
    }

    @Test
    void testCloseWithActiveTransactionIsRejected() {
        open(DrawerOptions.defaults());
        async.beginTransaction().join();

        assertThrows(TransactionException.class, async::close);
        assertFalse(async.isClosed());

        async.rollback().join();
    }

    @Test
    void testCloseSeesTransactionBegunByQueuedWork() {
        open(DrawerOptions.builder().workerCount(1).build());

        CompletableFuture<Void> slow = async.putModel("slow", new SlowModel());
        CompletableFuture<Void> begin = async.beginTransaction();

        assertThrows(TransactionException.class, async::close);
        assertTrue(slow.isDone());
        assertTrue(begin.isDone());
        assertFalse(async.isClosed());
        assertFalse(async.drawer().isClosed());
        assertTrue(async.isTransactionActive().join());

        async.put("inside", 1).join();
        async.commit().join();
        assertEquals(1, async.getFresh("inside").join());

        async.close();
        assertTrue(async.isClosed());
    }

    @Test
    void testCancelDoesNotInterruptDispatchedWork() throws Exception {
        open(DrawerOptions.builder().workerCount(1).build());
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> running = async.inTransaction(() -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            async.drawer().put("finished", true);
            return "done";
        });
        CompletableFuture<Void> queued = async.put("skipped", 1);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(running.cancel(true));
        assertTrue(queued.cancel(true));
        release.countDown();

        assertEquals(true, async.get("finished").join());
        assertFalse(async.containsKey("skipped").join());
    }

    public static class SlowModel {
        public String getName() {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "slow";
        }
    }
}
