package io.captionsync.engine;

import io.captionsync.model.ChangeRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Installs the version clock and per-table change triggers into an image. Every step is idempotent,
 * so an image exported from an engine can be opened again.
 */
final class ChangeTracking {
    static final String META_TABLE = "crr_meta";
    static final String CLOCK_TABLE = "crr_clock";
    private static final String ROWID = "rowid";

    private ChangeTracking() {
    }

    static Map<String, TableInfo> install(Connection conn, List<String> replicatedTables, String siteId) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS crr_meta (
                        id INTEGER PRIMARY KEY CHECK (id = 1),
                        db_version INTEGER NOT NULL DEFAULT 0,
                        pending_version INTEGER NOT NULL DEFAULT 0,
                        seq_counter INTEGER NOT NULL DEFAULT 0,
                        site_id TEXT NOT NULL DEFAULT '',
                        applying INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            ensureMetaColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS crr_clock (
                        tbl TEXT NOT NULL,
                        pk TEXT NOT NULL,
                        cid TEXT NOT NULL,
                        val,
                        col_version INTEGER NOT NULL,
                        db_version INTEGER NOT NULL,
                        site_id TEXT NOT NULL,
                        seq INTEGER NOT NULL DEFAULT 0,
                        PRIMARY KEY (tbl, pk, cid)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_crr_clock_version ON crr_clock(db_version, seq)");
            st.execute("INSERT OR IGNORE INTO crr_meta(id, db_version, pending_version, seq_counter, site_id, applying) VALUES(1, 0, 0, 0, '', 0)");
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE crr_meta SET site_id=?, applying=0, pending_version=db_version, seq_counter=0 WHERE id=1")) {
            ps.setString(1, siteId);
            ps.executeUpdate();
        }

        Map<String, TableInfo> tracked = new LinkedHashMap<>();
        Set<String> existing = existingTables(conn);
        for (String table : replicatedTables) {
            if (!existing.contains(table.toLowerCase(Locale.ROOT))) {
                continue;
            }
            TableInfo info = describe(conn, table);
            installTriggers(conn, info);
            tracked.put(table, info);
        }
        return tracked;
    }

    private static void ensureMetaColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(crr_meta)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("pending_version")) {
                st.execute("ALTER TABLE crr_meta ADD COLUMN pending_version INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("seq_counter")) {
                st.execute("ALTER TABLE crr_meta ADD COLUMN seq_counter INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("site_id")) {
                st.execute("ALTER TABLE crr_meta ADD COLUMN site_id TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("applying")) {
                st.execute("ALTER TABLE crr_meta ADD COLUMN applying INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private static Set<String> existingTables(Connection conn) throws SQLException {
        Set<String> out = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type='table'")) {
            while (rs.next()) {
                out.add(rs.getString(1).toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    static TableInfo describe(Connection conn, String table) throws SQLException {
        TreeMap<Integer, String> pk = new TreeMap<>();
        List<String> columns = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + ident(table) + ")")) {
            while (rs.next()) {
                String name = rs.getString("name");
                int pkIndex = rs.getInt("pk");
                if (pkIndex > 0) {
                    pk.put(pkIndex, name);
                } else {
                    columns.add(name);
                }
            }
        }
        List<String> pkColumns = pk.isEmpty() ? List.of(ROWID) : new ArrayList<>(pk.values());
        return new TableInfo(table, pkColumns, columns);
    }

    private static void installTriggers(Connection conn, TableInfo table) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(insertTrigger(table));
            st.execute(updateTrigger(table));
            st.execute(deleteTrigger(table));
        }
    }

    private static String insertTrigger(TableInfo table) {
        String pk = pkExpr(table, "NEW");
        StringBuilder body = new StringBuilder();
        body.append(clockWrite(table, pk, ChangeRecord.ROW_SENTINEL, "1", null));
        for (String column : table.columns()) {
            body.append(clockWrite(table, pk, column, "NEW." + ident(column), null));
        }
        return trigger(table, "ins", "AFTER INSERT", body);
    }

    private static String updateTrigger(TableInfo table) {
        String oldPk = pkExpr(table, "OLD");
        String newPk = pkExpr(table, "NEW");
        String pkChanged = oldPk + " IS NOT " + newPk;
        StringBuilder body = new StringBuilder();
        // A primary-key change is a delete of the old row plus an insert of the new one.
        body.append(clockWrite(table, oldPk, ChangeRecord.ROW_SENTINEL, "0", pkChanged));
        body.append(clockWrite(table, newPk, ChangeRecord.ROW_SENTINEL, "1", pkChanged));
        for (String column : table.columns()) {
            String guard = "(OLD." + ident(column) + " IS NOT NEW." + ident(column) + " OR " + pkChanged + ")";
            body.append(clockWrite(table, newPk, column, "NEW." + ident(column), guard));
        }
        return trigger(table, "upd", "AFTER UPDATE", body);
    }

    private static String deleteTrigger(TableInfo table) {
        StringBuilder body = new StringBuilder();
        body.append(clockWrite(table, pkExpr(table, "OLD"), ChangeRecord.ROW_SENTINEL, "0", null));
        return trigger(table, "del", "AFTER DELETE", body);
    }

    private static String trigger(TableInfo table, String suffix, String event, StringBuilder body) {
        return "CREATE TRIGGER IF NOT EXISTS " + ident("crr_" + table.name() + "_" + suffix)
                + " " + event + " ON " + ident(table.name())
                + " WHEN (SELECT applying FROM crr_meta WHERE id=1) = 0"
                + " BEGIN\n" + body + "END";
    }

    private static String clockWrite(TableInfo table, String pkExpr, String cid, String valExpr, String guard) {
        String tbl = literal(table.name());
        String col = literal(cid);
        String extra = guard == null ? "" : " AND " + guard;
        return "UPDATE crr_meta SET seq_counter = seq_counter + 1 WHERE id=1" + extra + ";\n"
                + "INSERT OR REPLACE INTO crr_clock(tbl, pk, cid, val, col_version, db_version, site_id, seq) "
                + "SELECT " + tbl + ", " + pkExpr + ", " + col + ", " + valExpr + ", "
                + "COALESCE((SELECT c.col_version FROM crr_clock c WHERE c.tbl=" + tbl
                + " AND c.pk=" + pkExpr + " AND c.cid=" + col + "), 0) + 1, "
                + "m.pending_version, m.site_id, m.seq_counter FROM crr_meta m WHERE m.id=1" + extra + ";\n";
    }

    static String pkExpr(TableInfo table, String alias) {
        List<String> parts = new ArrayList<>();
        for (String column : table.pkColumns()) {
            parts.add(alias + "." + ident(column));
        }
        return "json_array(" + String.join(", ", parts) + ")";
    }

    static String ident(String name) {
        if (ROWID.equalsIgnoreCase(name)) {
            return ROWID;
        }
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    private static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
