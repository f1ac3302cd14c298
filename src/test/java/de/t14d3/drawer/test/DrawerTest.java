package de.t14d3.drawer.test;

import de.t14d3.drawer.core.Drawer;
import de.t14d3.drawer.core.DrawerOptions;
import de.t14d3.drawer.exceptions.CacheException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.exceptions.ValidationException;
import de.t14d3.drawer.query.QueryRequest;
import de.t14d3.drawer.serialization.ValueEncryptor;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class DrawerTest {
    @TempDir
    Path tempDir;

    private String dbPath;
    private Drawer drawer;

    @BeforeEach
    void setup() {
        dbPath = tempDir.resolve("drawer.db").toString();
        drawer = Drawer.open(dbPath);
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

    private Drawer reopen(DrawerOptions options) {
        drawer.close();
        drawer = Drawer.open(dbPath, options);
        return drawer;
    }

    @Test
    void testScalarRoundTripThroughStorage() {
        drawer.put("string", "hello");
        drawer.put("int", 42);
        drawer.put("long", 10_000_000_000L);
        drawer.put("double", 3.25);
        drawer.put("bool", true);
        drawer.put("null", null);

        reopen(DrawerOptions.defaults());

        assertEquals("hello", drawer.get("string"));
        assertEquals(42, drawer.get("int"));
        assertEquals(10_000_000_000L, drawer.get("long"));
        assertEquals(3.25, drawer.get("double"));
        assertEquals(true, drawer.get("bool"));
        assertNull(drawer.get("null"));
        assertTrue(drawer.containsKey("null"));
    }

    @Test
    void testDeeplyNestedRoundTrip() {
        Map<String, Object> nested = new LinkedHashMap<>();
        Map<String, Object> current = nested;
        for (int level = 0; level < 30; level++) {
            Map<String, Object> child = new LinkedHashMap<>();
            current.put("level", level);
            current.put("items", List.of("x", level, List.of(true, false)));
            current.put("child", child);
            current = child;
        }
        current.put("leaf", "bottom");

        drawer.put("deep", nested);
        reopen(DrawerOptions.defaults());

        assertEquals(nested, drawer.get("deep"));
    }

    @Test
    void testMissingKeys() {
        assertThrows(NoSuchElementException.class, () -> drawer.get("missing"));
        assertEquals("fallback", drawer.get("missing", "fallback"));
        assertThrows(NoSuchElementException.class, () -> drawer.remove("missing"));
        assertFalse(drawer.containsKey("missing"));
    }

    @Test
    void testPutOverwritesAndRemoveDeletes() {
        drawer.put("k", "v1");
        drawer.put("k", "v2");
        assertEquals("v2", drawer.get("k"));
        assertEquals(1, drawer.size());

        drawer.remove("k");
        assertFalse(drawer.containsKey("k"));
        assertTrue(drawer.isEmpty());
    }

    @Test
    void testGetAll() {
        drawer.putAll(Map.of("a", 1, "b", 2));
        drawer.refresh();
        drawer.get("b");

        Map<String, Object> found = drawer.getAll(List.of("b", "x", "a"));
        assertEquals(List.of("b", "a"), new ArrayList<>(found.keySet()));
        assertEquals(Map.of("a", 1, "b", 2), found);
        assertTrue(drawer.getAll(List.of()).isEmpty());
    }

    @Test
    void testPop() {
        drawer.put("k", List.of(1, 2));
        assertEquals(List.of(1, 2), drawer.pop("k"));
        assertFalse(drawer.containsKey("k"));
        assertEquals("dflt", drawer.pop("k", "dflt"));
        assertThrows(NoSuchElementException.class, () -> drawer.pop("k"));
    }

    @Test
    void testPutIfAbsentKeepsExistingValue() {
        assertEquals("first", drawer.putIfAbsent("k", "first"));
        assertEquals("first", drawer.putIfAbsent("k", "second"));
        assertEquals("first", drawer.get("k"));
    }

    @Test
    void testCollectionViews() {
        drawer.putAll(Map.of("a", 1, "b", 2, "c", 3));

        assertEquals(3, drawer.size());
        assertEquals(Set.of("a", "b", "c"), new HashSet<>(drawer.keys()));
        assertEquals(Set.of(1, 2, 3), new HashSet<>(drawer.values()));
        assertEquals(Map.of("a", 1, "b", 2, "c", 3), drawer.toMap());
        assertEquals(drawer.toMap(), drawer.copy());
        assertEquals(3, drawer.entries().size());
    }

    @Test
    void testClearRemovesRowsAndCache() {
        drawer.putAll(Map.of("a", 1, "b", 2));
        drawer.clear();

        assertEquals(0, drawer.size());
        assertFalse(drawer.isCached("a"));
        assertFalse(drawer.containsKey("b"));
    }

    @Test
    void testBatchOperations() {
        Map<String, Object> batch = new LinkedHashMap<>();
        for (int i = 0; i < 1200; i++) {
            batch.put("key" + i, Map.of("n", i));
        }
        drawer.batchUpdate(batch);
        assertEquals(1200, drawer.size());
        assertTrue(drawer.isCached("key999"));

        List<String> toDelete = new ArrayList<>();
        for (int i = 0; i < 1100; i++) {
            toDelete.add("key" + i);
        }
        toDelete.add("not-there");
        assertEquals(1100, drawer.batchDelete(toDelete));
        assertEquals(100, drawer.size());
        assertFalse(drawer.isCached("key0"));
        assertEquals(Map.of("n", 1150), drawer.get("key1150"));
    }

    @Test
    void testBatchUpdateIsAtomicOnBadValue() {
        Map<String, Object> batch = new LinkedHashMap<>();
        batch.put("good", 1);
        batch.put("bad", new Object());

        assertThrows(CacheException.class, () -> drawer.batchUpdate(batch));
        assertFalse(drawer.containsKey("good"));
    }

    @Test
    void testRawWriteIsStaleUntilRefresh() {
        drawer.put("k", 1);
        drawer.execute("UPDATE \"data\" SET \"value\" = ? WHERE \"key\" = ?", "2", "k");

        assertEquals(1, drawer.get("k"));
        assertEquals(2, drawer.getFresh("k"));
        assertEquals(2, drawer.get("k"));

        drawer.execute("UPDATE \"data\" SET \"value\" = ? WHERE \"key\" = ?", "3", "k");
        drawer.refresh("k");
        assertEquals(3, drawer.get("k"));

        drawer.execute("UPDATE \"data\" SET \"value\" = ? WHERE \"key\" = ?", "4", "k");
        drawer.refresh();
        assertFalse(drawer.isCached("k"));
        assertEquals(4, drawer.get("k"));
    }

    @Test
    void testGetFreshOfMissingKey() {
        assertThrows(NoSuchElementException.class, () -> drawer.getFresh("nope"));
        assertEquals(0, drawer.getFresh("nope", 0));
    }

    @Test
    void testFetchHelpers() {
        drawer.put("a", "x");
        drawer.put("b", "y");

        List<Object> count = drawer.fetchOne("SELECT COUNT(*) FROM \"data\"");
        assertEquals(2, ((Number) count.get(0)).intValue());
        assertEquals(2, drawer.fetchAll("SELECT \"key\" FROM \"data\" ORDER BY \"key\"").size());
        assertNull(drawer.fetchOne("SELECT \"key\" FROM \"data\" WHERE \"key\" = ?", "zzz"));
        assertThrows(DatabaseException.class, () -> drawer.fetchAll("DELETE FROM \"data\""));
        assertEquals(2, drawer.size());
    }

    @Test
    void testQuery() {
        drawer.put("user1", Map.of("name", "alice"));
        drawer.put("user2", Map.of("name", "bob"));
        drawer.put("other", 1);

        List<Map<String, Object>> rows = drawer.query(QueryRequest.builder()
                .columns("key")
                .where("\"key\" LIKE ?", "user%")
                .orderBy("key DESC")
                .build());
        assertEquals(2, rows.size());
        assertEquals("user2", rows.get(0).get("key"));

        List<Map<String, Object>> counted = drawer.query(QueryRequest.builder()
                .columns("COUNT(*) AS n")
                .build());
        assertEquals(3, ((Number) counted.get(0).get("n")).intValue());

        List<Map<String, Object>> paged = drawer.query(QueryRequest.builder()
                .columns("key")
                .orderBy("key")
                .limit(1)
                .offset(1)
                .build());
        assertEquals("user1", paged.get(0).get("key"));
    }

    @Test
    void testQueryRejectsUnsafeFragments() {
        assertThrows(ValidationException.class, () -> drawer.query(QueryRequest.builder()
                .orderBy("key; DROP TABLE data")
                .build()));
        assertThrows(ValidationException.class, () -> drawer.query(QueryRequest.builder()
                .columns("hex(value)")
                .build()));
        assertThrows(ValidationException.class, () -> drawer.query(QueryRequest.builder()
                .table("data; x")
                .build()));

        List<Map<String, Object>> rows = drawer.query(QueryRequest.builder()
                .columns("hex(value) AS h")
                .allowFunctions("hex")
                .build());
        assertTrue(rows.isEmpty());
    }

    @Test
    void testNonStrictValidationAcceptsUnknownFunctions() {
        reopen(DrawerOptions.builder().strictValidation(false).build());
        drawer.put("k", "v");

        List<Map<String, Object>> rows = drawer.query(QueryRequest.builder()
                .columns("hex(\"key\") AS h")
                .build());
        assertEquals("6B", rows.get(0).get("h"));
    }

    @Test
    void testModels() {
        Profile profile = new Profile();
        profile.setName("alice");
        profile.setAge(31);
        profile.setTags(List.of("admin", "ops"));

        drawer.putModel("profile", profile);
        reopen(DrawerOptions.defaults());

        assertEquals(Map.of("name", "alice", "age", 31, "tags", List.of("admin", "ops")), drawer.get("profile"));
        Profile loaded = drawer.getModel("profile", Profile.class);
        assertEquals("alice", loaded.getName());
        assertEquals(31, loaded.getAge());
        assertEquals(List.of("admin", "ops"), loaded.getTags());
    }

    @Test
    void testEncryptorHookAppliesToStoredPayload() {
        ValueEncryptor reversing = new ValueEncryptor() {
            @Override
            public String encrypt(String plaintext) {
                return new StringBuilder(plaintext).reverse().toString();
            }

            @Override
            public String decrypt(String ciphertext) {
                return new StringBuilder(ciphertext).reverse().toString();
            }
        };
        reopen(DrawerOptions.builder().valueEncryptor(reversing).build());

        drawer.put("secret", "abc");
        List<Object> raw = drawer.fetchOne("SELECT \"value\" FROM \"data\" WHERE \"key\" = ?", "secret");
        assertEquals("\"cba\"", raw.get(0));
        assertEquals("abc", drawer.getFresh("secret"));
    }

    @Test
    void testBulkPreload() {
        drawer.putAll(Map.of("a", 1, "b", 2));
        reopen(DrawerOptions.builder().bulkPreload(true).build());

        assertTrue(drawer.isCached("a"));
        assertTrue(drawer.isCached("b"));
        assertEquals(Set.of("a", "b"), drawer.cachedKeys());
    }

    @Test
    void testLruCacheThroughDrawer() {
        reopen(DrawerOptions.builder().lru(2).build());
        drawer.put("a", 1);
        drawer.put("b", 2);
        drawer.put("c", 3);

        assertEquals(Set.of("b", "c"), drawer.cachedKeys());
        assertEquals(1, drawer.get("a"));
        assertEquals(Set.of("a", "c"), drawer.cachedKeys());
    }

    @Test
    void testTtlWithoutCascadeReadsThroughAgain() {
        MutableClock clock = new MutableClock();
        reopen(DrawerOptions.builder().ttl(Duration.ofSeconds(10), false).clock(clock).build());

        drawer.put("k", "v");
        clock.advance(Duration.ofSeconds(11));

        assertEquals(Set.of("k"), drawer.cachedKeys());
        assertEquals(1, drawer.sweepExpired());
        assertFalse(drawer.isCached("k"));
        assertEquals("v", drawer.get("k"));
    }

    @Test
    void testTtlWithCascadeDeletesRow() {
        MutableClock clock = new MutableClock();
        reopen(DrawerOptions.builder().ttl(Duration.ofSeconds(10), true).clock(clock).build());

        drawer.put("k", "v");
        drawer.put("other", "w");
        clock.advance(Duration.ofSeconds(11));

        assertFalse(drawer.containsKey("k"));
        assertNull(drawer.fetchOne("SELECT 1 FROM \"data\" WHERE \"key\" = ?", "k"));

        assertEquals(1, drawer.sweepExpired());
        assertEquals(0, drawer.size());
    }

    @Test
    void testChildTablesAreIndependent() {
        Drawer users = drawer.table("users");
        users.put("k", "user");
        drawer.put("k", "root");

        assertEquals("user", users.get("k"));
        assertEquals("root", drawer.get("k"));
        assertEquals("users", users.tableName());
        assertFalse(users.isRoot());
        assertThrows(ValidationException.class, () -> drawer.table("bad name"));
    }

    @Test
    void testEngineHousekeeping() {
        assertEquals("wal", String.valueOf(drawer.pragma("journal_mode")).toLowerCase(Locale.ROOT));
        drawer.pragma("cache_size", -4096);
        assertEquals(-4096, ((Number) drawer.pragma("cache_size")).intValue());
        assertThrows(ValidationException.class, () -> drawer.pragma("journal_mode", "wal; drop"));
        assertThrows(ValidationException.class, () -> drawer.pragma("bad name"));

        drawer.put("k", "v");
        int[] result = drawer.checkpoint("truncate");
        assertEquals(3, result.length);
        assertEquals(0, result[0]);
        assertThrows(ValidationException.class, () -> drawer.checkpoint("NOW"));

        assertDoesNotThrow(drawer::vacuum);
        assertEquals("v", drawer.getFresh("k"));
    }

    @Test
    void testToStringNamesTable() {
        assertTrue(drawer.toString().contains("table='data'"));
    }

    public static class Profile {
        private String name;
        private int age;
        private List<String> tags;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getAge() {
            return age;
        }

        public void setAge(int age) {
            this.age = age;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }
    }
}
