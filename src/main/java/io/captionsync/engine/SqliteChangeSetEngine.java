package io.captionsync.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.captionsync.error.ApplyChangesException;
import io.captionsync.error.CorruptImageException;
import io.captionsync.error.DatabaseException;
import io.captionsync.error.ErrorCode;
import io.captionsync.error.QueryException;
import io.captionsync.model.ChangeRecord;
import io.captionsync.model.ChangeSet;
import io.captionsync.model.InstanceId;
import io.captionsync.model.QueryResult;
import io.captionsync.model.VersionInfo;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class SqliteChangeSetEngine implements ChangeSetEngine {
    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);
    private static final Set<String> READ_ONLY_KEYWORDS = Set.of("SELECT", "WITH", "PRAGMA", "EXPLAIN", "VALUES");

    private final InstanceId instanceId;
    private final Path workingFile;
    private final Connection conn;
    private final String siteId;
    private final Map<String, TableInfo> tables;
    private boolean closed;

    private SqliteChangeSetEngine(InstanceId instanceId, Path workingFile, Connection conn, String siteId, Map<String, TableInfo> tables) {
        this.instanceId = instanceId;
        this.workingFile = workingFile;
        this.conn = conn;
        this.siteId = siteId;
        this.tables = tables;
    }

    /**
     * Copies {@code image} into {@code workDir} and opens it with change tracking installed.
     */
    public static SqliteChangeSetEngine open(InstanceId instanceId, byte[] image, Path workDir) {
        validateHeader(instanceId, image);
        Path file;
        try {
            Files.createDirectories(workDir);
            file = workDir.resolve(instanceId.videoId() + "-" + instanceId.databaseName().wireName()
                    + "-" + UUID.randomUUID() + ".db");
            Files.write(file, image);
        } catch (IOException e) {
            throw new DatabaseException(ErrorCode.DATABASE_INIT_FAILED,
                    "Failed to write working image for " + instanceId, instanceId, e);
        }
        Connection conn = null;
        try {
            conn = DriverManager.getConnection("jdbc:sqlite:" + file);
            checkIntegrity(instanceId, conn);
            String siteId = UUID.randomUUID().toString();
            Map<String, TableInfo> tables = ChangeTracking.install(
                    conn, instanceId.databaseName().replicatedTables(), siteId);
            return new SqliteChangeSetEngine(instanceId, file, conn, siteId, tables);
        } catch (SQLException | RuntimeException e) {
            closeQuietly(conn, e);
            deleteFiles(file);
            if (e instanceof DatabaseException typed) {
                throw typed;
            }
            throw new CorruptImageException("Database image for " + instanceId + " is unreadable: " + e.getMessage(),
                    instanceId, e);
        }
    }

    private static void validateHeader(InstanceId instanceId, byte[] image) {
        if (image == null || image.length == 0) {
            throw new CorruptImageException("Database image for " + instanceId + " is empty", instanceId, null);
        }
        if (image.length < SQLITE_HEADER.length
                || !Arrays.equals(Arrays.copyOf(image, SQLITE_HEADER.length), SQLITE_HEADER)) {
            throw new CorruptImageException("Database image for " + instanceId + " lacks the SQLite header",
                    instanceId, null);
        }
    }

    private static void checkIntegrity(InstanceId instanceId, Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA quick_check")) {
            String result = rs.next() ? rs.getString(1) : "";
            if (!"ok".equalsIgnoreCase(result)) {
                throw new CorruptImageException("Database image for " + instanceId + " failed integrity check: " + result,
                        instanceId, null);
            }
        }
    }

    @Override
    public InstanceId instanceId() {
        return instanceId;
    }

    @Override
    public synchronized QueryResult query(String sql, List<?> params) {
        ensureOpen();
        if (!isReadOnly(sql)) {
            throw new QueryException(ErrorCode.INVALID_QUERY,
                    "Only read statements are allowed in query", instanceId, sql, null);
        }
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    return readResult(rs);
                }
            } finally {
                // Read transactions are always rolled back so a query can never leave a write behind.
                conn.rollback();
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new QueryException(ErrorCode.QUERY_FAILED, "Query failed: " + e.getMessage(), instanceId, sql, e);
        }
    }

    @Override
    public synchronized int exec(String sql, List<?> params) {
        ensureOpen();
        if (sql == null || sql.isBlank()) {
            throw new QueryException(ErrorCode.INVALID_QUERY, "Statement must not be blank", instanceId, sql, null);
        }
        try {
            conn.setAutoCommit(false);
            try {
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("UPDATE crr_meta SET pending_version = db_version + 1, seq_counter = 0 WHERE id=1");
                }
                int affected;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, params);
                    boolean hasResultSet = ps.execute();
                    affected = hasResultSet ? 0 : Math.max(0, ps.getUpdateCount());
                }
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("""
                            UPDATE crr_meta SET db_version = pending_version
                            WHERE id=1 AND EXISTS (
                                SELECT 1 FROM crr_clock WHERE db_version = (SELECT pending_version FROM crr_meta WHERE id=1)
                            )
                            """);
                }
                conn.commit();
                return affected;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new QueryException(ErrorCode.QUERY_FAILED, "Statement failed: " + e.getMessage(), instanceId, sql, e);
        }
    }

    @Override
    public synchronized VersionInfo getVersionInfo() {
        ensureOpen();
        try {
            return new VersionInfo(currentVersion(), siteId);
        } catch (SQLException e) {
            throw new DatabaseException(ErrorCode.DATABASE_INIT_FAILED, "Failed to read version", instanceId, e);
        }
    }

    @Override
    public synchronized ChangeSet getChangesSince(long version) {
        ensureOpen();
        try {
            List<ChangeRecord> records = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT tbl, pk, cid, val, col_version, db_version, site_id, seq
                    FROM crr_clock
                    WHERE db_version > ?
                    ORDER BY db_version, seq, tbl, pk, cid
                    """)) {
                ps.setLong(1, version);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        records.add(new ChangeRecord(
                                rs.getString("tbl"),
                                rs.getString("pk"),
                                rs.getString("cid"),
                                rs.getObject("val"),
                                rs.getLong("col_version"),
                                rs.getLong("db_version"),
                                rs.getString("site_id"),
                                rs.getInt("seq")
                        ));
                    }
                }
            }
            long current = currentVersion();
            return new ChangeSet(version, Math.max(version, current), records);
        } catch (SQLException e) {
            throw new DatabaseException(ErrorCode.QUERY_FAILED, "Failed to read changes since " + version, instanceId, e);
        }
    }

    @Override
    public synchronized long applyChanges(ChangeSet changes) {
        ensureOpen();
        if (changes == null) {
            throw new ApplyChangesException("Change set must not be null", instanceId, null);
        }
        try {
            conn.setAutoCommit(false);
            try {
                long current = currentVersion();
                long nextVersion = current + 1L;
                setApplying(true);
                Set<RowKey> touched = new LinkedHashSet<>();
                int seq = 0;
                for (ChangeRecord record : changes.records()) {
                    validate(record);
                    TableInfo table = tables.get(record.table());
                    if (table == null) {
                        continue;
                    }
                    if (!wins(record)) {
                        continue;
                    }
                    writeClock(record, nextVersion, seq++);
                    touched.add(new RowKey(table, record.pk()));
                }
                for (RowKey row : touched) {
                    materialize(row.table(), row.pk());
                }
                long resulting = touched.isEmpty()
                        ? Math.max(current, changes.resultingVersion())
                        : Math.max(nextVersion, changes.resultingVersion());
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE crr_meta SET db_version=?, pending_version=?, applying=0 WHERE id=1")) {
                    ps.setLong(1, resulting);
                    ps.setLong(2, resulting);
                    ps.executeUpdate();
                }
                conn.commit();
                return resulting;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (ApplyChangesException e) {
            throw e;
        } catch (SQLException | RuntimeException e) {
            throw new ApplyChangesException("Failed to apply " + changes.size() + " change(s): " + e.getMessage(),
                    instanceId, e);
        }
    }

    @Override
    public synchronized void observeVersion(long version) {
        ensureOpen();
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE crr_meta SET db_version = MAX(db_version, ?) WHERE id=1")) {
            ps.setLong(1, version);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException(ErrorCode.UNKNOWN_ERROR, "Failed to record server version " + version, instanceId, e);
        }
    }

    @Override
    public List<String> replicatedTables() {
        return List.copyOf(tables.keySet());
    }

    @Override
    public synchronized byte[] exportImage() {
        ensureOpen();
        Path target = workingFile.resolveSibling(workingFile.getFileName() + ".export-" + UUID.randomUUID());
        try (Statement st = conn.createStatement()) {
            st.execute("VACUUM INTO '" + target.toString().replace("'", "''") + "'");
            return Files.readAllBytes(target);
        } catch (SQLException | IOException e) {
            throw new DatabaseException(ErrorCode.UNKNOWN_ERROR, "Failed to export image for " + instanceId, instanceId, e);
        } finally {
            deleteFiles(target);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            conn.close();
        } catch (SQLException e) {
            throw new DatabaseException(ErrorCode.UNKNOWN_ERROR, "Failed to close " + instanceId, instanceId, e);
        } finally {
            deleteFiles(workingFile);
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    Path workingFile() {
        return workingFile;
    }

    private boolean wins(ChangeRecord record) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT col_version, site_id FROM crr_clock WHERE tbl=? AND pk=? AND cid=?")) {
            ps.setString(1, record.table());
            ps.setString(2, record.pk());
            ps.setString(3, record.cid());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return true;
                }
                long localVersion = rs.getLong(1);
                String localSite = rs.getString(2);
                if (record.colVersion() != localVersion) {
                    return record.colVersion() > localVersion;
                }
                return safe(record.siteId()).compareTo(safe(localSite)) > 0;
            }
        }
    }

    private void writeClock(ChangeRecord record, long dbVersion, int seq) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT OR REPLACE INTO crr_clock(tbl, pk, cid, val, col_version, db_version, site_id, seq)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, record.table());
            ps.setString(2, record.pk());
            ps.setString(3, record.cid());
            ps.setObject(4, bindable(record.val()));
            ps.setLong(5, record.colVersion());
            ps.setLong(6, dbVersion);
            ps.setString(7, safe(record.siteId()));
            ps.setInt(8, seq);
            ps.executeUpdate();
        }
    }

    private void materialize(TableInfo table, String pk) throws SQLException {
        List<Object> pkValues = parsePk(pk);
        if (pkValues.size() != table.pkColumns().size()) {
            throw new ApplyChangesException("Primary key " + pk + " does not match table " + table.name(), instanceId, null);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Boolean alive = null;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT cid, val FROM crr_clock WHERE tbl=? AND pk=? ORDER BY cid")) {
            ps.setString(1, table.name());
            ps.setString(2, pk);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String cid = rs.getString(1);
                    Object val = rs.getObject(2);
                    if (ChangeRecord.ROW_SENTINEL.equals(cid)) {
                        alive = val instanceof Number n ? n.longValue() != 0L : val != null && !"0".equals(String.valueOf(val));
                    } else if (table.hasColumn(cid)) {
                        values.put(cid, val);
                    }
                }
            }
        }
        String where = pkWhere(table);
        if (Boolean.FALSE.equals(alive)) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + ChangeTracking.ident(table.name()) + " WHERE " + where)) {
                bindAll(ps, 1, pkValues);
                ps.executeUpdate();
            }
            return;
        }
        boolean exists;
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM " + ChangeTracking.ident(table.name()) + " WHERE " + where)) {
            bindAll(ps, 1, pkValues);
            try (ResultSet rs = ps.executeQuery()) {
                exists = rs.next();
            }
        }
        if (exists) {
            if (values.isEmpty()) {
                return;
            }
            List<String> sets = new ArrayList<>();
            for (String column : values.keySet()) {
                sets.add(ChangeTracking.ident(column) + "=?");
            }
            String sql = "UPDATE " + ChangeTracking.ident(table.name()) + " SET " + String.join(", ", sets) + " WHERE " + where;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int next = bindAll(ps, 1, new ArrayList<>(values.values()));
                bindAll(ps, next, pkValues);
                ps.executeUpdate();
            }
            return;
        }
        List<String> columns = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        for (int i = 0; i < table.pkColumns().size(); i++) {
            columns.add(ChangeTracking.ident(table.pkColumns().get(i)));
            args.add(pkValues.get(i));
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            columns.add(ChangeTracking.ident(entry.getKey()));
            args.add(entry.getValue());
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        String sql = "INSERT INTO " + ChangeTracking.ident(table.name())
                + "(" + String.join(", ", columns) + ") VALUES(" + placeholders + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindAll(ps, 1, args);
            ps.executeUpdate();
        }
    }

    private static String pkWhere(TableInfo table) {
        List<String> parts = new ArrayList<>();
        for (String column : table.pkColumns()) {
            parts.add(ChangeTracking.ident(column) + "=?");
        }
        return String.join(" AND ", parts);
    }

    private List<Object> parsePk(String pk) {
        try {
            JsonNode node = Jsons.mapper().readTree(pk);
            if (node == null || !node.isArray()) {
                throw new ApplyChangesException("Primary key must be a JSON array: " + pk, instanceId, null);
            }
            List<Object> out = new ArrayList<>();
            for (JsonNode value : node) {
                if (value.isNull()) {
                    out.add(null);
                } else if (value.isIntegralNumber()) {
                    out.add(value.longValue());
                } else if (value.isNumber()) {
                    out.add(value.doubleValue());
                } else {
                    out.add(value.asText());
                }
            }
            return out;
        } catch (IOException e) {
            throw new ApplyChangesException("Malformed primary key: " + pk, instanceId, e);
        }
    }

    private void validate(ChangeRecord record) {
        if (record == null || record.table() == null || record.pk() == null || record.cid() == null) {
            throw new ApplyChangesException("Change record is missing table, pk or cid", instanceId, null);
        }
        if (record.colVersion() < 1L) {
            throw new ApplyChangesException("Change record has invalid col_version " + record.colVersion(), instanceId, null);
        }
    }

    private void setApplying(boolean applying) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("UPDATE crr_meta SET applying=" + (applying ? 1 : 0) + " WHERE id=1");
        }
    }

    private long currentVersion() throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT db_version FROM crr_meta WHERE id=1")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private QueryResult readResult(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                row.put(columns.get(i - 1), rs.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    private void ensureOpen() {
        if (closed) {
            throw new DatabaseException(ErrorCode.NOT_INITIALIZED, "Engine for " + instanceId + " is closed", instanceId, null);
        }
    }

    static boolean isReadOnly(String sql) {
        if (sql == null) {
            return false;
        }
        String trimmed = sql.stripLeading();
        while (trimmed.startsWith("(")) {
            trimmed = trimmed.substring(1).stripLeading();
        }
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return READ_ONLY_KEYWORDS.contains(trimmed.substring(0, end).toUpperCase(Locale.ROOT));
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        if (params == null) {
            return;
        }
        bindAll(ps, 1, params);
    }

    private static int bindAll(PreparedStatement ps, int start, List<?> values) throws SQLException {
        int index = start;
        for (Object value : values) {
            ps.setObject(index++, bindable(value));
        }
        return index;
    }

    private static Object bindable(Object value) {
        if (value == null || value instanceof Number || value instanceof String || value instanceof byte[]) {
            return value;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return Jsons.toCompactJson(value);
        }
        return String.valueOf(value);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static void closeQuietly(Connection conn, Exception primary) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    private static void deleteFiles(Path file) {
        for (String suffix : List.of("", "-journal", "-wal", "-shm")) {
            try {
                Files.deleteIfExists(file.resolveSibling(file.getFileName() + suffix));
            } catch (IOException e) {
                throw new RuntimeException("Failed to delete working file: " + file + suffix, e);
            }
        }
    }

    private record RowKey(TableInfo table, String pk) {
    }
}
