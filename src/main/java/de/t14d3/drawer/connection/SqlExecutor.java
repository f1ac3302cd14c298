package de.t14d3.drawer.connection;

import de.t14d3.drawer.exceptions.DatabaseException;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Executes parameterized SQL on a given connection and maps result rows.
 *
 * Callers are responsible for holding whatever lock guards the connection.
 */
public final class SqlExecutor {

    private SqlExecutor() {
    }

    public static int executeUpdate(Connection connection, String sql, List<Object> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, params);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to execute UPDATE: " + sql, e);
        }
    }

    /**
     * Run any statement; rows are returned when it produces a result set, otherwise an empty list.
     */
    public static List<List<Object>> execute(Connection connection, String sql, List<Object> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, params);
            if (!stmt.execute()) {
                return new ArrayList<>();
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to execute SQL: " + sql, e);
        }
    }

    /**
     * Run a statement that must be a query. Engines reject non-queries before executing them.
     */
    public static List<List<Object>> queryRows(Connection connection, String sql, List<Object> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to execute query: " + sql, e);
        }
    }

    public static List<Map<String, Object>> queryMaps(Connection connection, String sql, List<Object> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int count = meta.getColumnCount();
                List<Map<String, Object>> results = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= count; i++) {
                        row.put(meta.getColumnLabel(i), readColumn(rs, i));
                    }
                    results.add(row);
                }
                return results;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to execute query: " + sql, e);
        }
    }

    private static List<List<Object>> readRows(ResultSet rs) throws SQLException {
        int count = rs.getMetaData().getColumnCount();
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(readColumn(rs, i));
            }
            rows.add(row);
        }
        return rows;
    }

    // Clob to String so rows outlive the result set
    private static Object readColumn(ResultSet rs, int index) throws SQLException {
        Object value = rs.getObject(index);
        if (value instanceof Clob clob) {
            String text = clob.getSubString(1, (int) clob.length());
            clob.free();
            return text;
        }
        return value;
    }

    // ---------------------------------------------------------------------
    // PreparedStatement parameter binding with simple type handling
    // ---------------------------------------------------------------------

    public static PreparedStatement setParameters(PreparedStatement stmt, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) return stmt;

        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;

            if (p == null) {
                stmt.setNull(idx, Types.NULL);
            } else if (p instanceof String s) {
                stmt.setString(idx, s);
            } else if (p instanceof Integer integer) {
                stmt.setInt(idx, integer);
            } else if (p instanceof Long l) {
                stmt.setLong(idx, l);
            } else if (p instanceof Boolean b) {
                stmt.setBoolean(idx, b);
            } else if (p instanceof Double v) {
                stmt.setDouble(idx, v);
            } else if (p instanceof Float v) {
                stmt.setFloat(idx, v);
            } else if (p instanceof Timestamp timestamp) {
                stmt.setTimestamp(idx, timestamp);
            } else if (p instanceof Date date) {
                stmt.setTimestamp(idx, new Timestamp(date.getTime()));
            } else if (p instanceof LocalDate localDate) {
                stmt.setDate(idx, java.sql.Date.valueOf(localDate));
            } else if (p instanceof LocalDateTime localDateTime) {
                stmt.setTimestamp(idx, Timestamp.valueOf(localDateTime));
            } else if (p instanceof UUID uuid) {
                stmt.setString(idx, uuid.toString());
            } else if (p instanceof Enum<?> anEnum) {
                stmt.setString(idx, anEnum.name());
            } else {
                // fallback - let JDBC try to handle it
                stmt.setObject(idx, p);
            }
        }
        return stmt;
    }
}
