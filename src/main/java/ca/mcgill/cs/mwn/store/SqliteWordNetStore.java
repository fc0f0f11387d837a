/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.io.File;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.Language;

import ca.mcgill.cs.mwn.util.MwnLogger;


/**
 * A {@link WordNetStore} over the SQLite databases of the MultiWordNet
 * distribution.  Each table lives in its own file, laid out as {@code
 * <dir>/<language>/<language>_<table>.db}; within that file the table is
 * named {@code <language>_<table>} or, in older builds, just {@code <table>}.
 *
 * <p>Connections are opened read-only on first use and kept until {@link
 * #close()}.  Instances are not thread-safe.
 */
public class SqliteWordNetStore implements WordNetStore {

    /**
     * The system property naming the database directory used by {@link
     * #openDefault()}.
     */
    public static final String DB_DIR_PROPERTY = "mwn.db.dir";

    /**
     * SQLite's {@code SQLITE_OPEN_READONLY} flag.
     */
    private static final String READ_ONLY_OPEN_MODE = "1";

    private final File dbDir;

    /**
     * Open connections, keyed by database file.
     */
    private final Map<File,Connection> connections =
        new HashMap<File,Connection>();

    /**
     * The SQL table name that holds each language table, or {@code null} for
     * files that do not contain it.
     */
    private final Map<String,String> sqlTableNames =
        new HashMap<String,String>();

    public SqliteWordNetStore(File dbDir) {
        if (!dbDir.isDirectory()) {
            throw new IllegalArgumentException(
                "Cannot find MultiWordNet database directory at " + dbDir);
        }
        this.dbDir = dbDir;
    }

    /**
     * Opens the store in the directory named by the {@value #DB_DIR_PROPERTY}
     * system property.
     *
     * @throws IllegalStateException if the property is not set
     */
    public static SqliteWordNetStore openDefault() {
        String dir = System.getProperty(DB_DIR_PROPERTY);
        if (dir == null) {
            throw new IllegalStateException(
                "No database directory; set -D" + DB_DIR_PROPERTY);
        }
        return new SqliteWordNetStore(new File(dir));
    }

    /**
     * Returns the file that holds the language's table.
     */
    public File getDatabaseFile(Language language, String table) {
        String code = language.getCode();
        return new File(new File(dbDir, code), code + "_" + table + ".db");
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<List<Row>> query(Language language, String table,
                                               Query query) {
        String sqlTable = resolveTable(language, table);
        if (sqlTable == null)
            return Optional.absent();

        StringBuilder sql = new StringBuilder("SELECT * FROM ")
            .append(quote(sqlTable));
        List<String> params = new ArrayList<String>();
        String sep = " WHERE ";
        for (Query.Condition c : query.getConditions()) {
            sql.append(sep);
            appendCondition(sql, params, c);
            sep = " AND ";
        }
        MwnLogger.veryVerbose("%s %s", sql, params);

        Connection conn = connect(getDatabaseFile(language, table));
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); ++i)
                ps.setString(i + 1, params.get(i));
            List<Row> rows = new ArrayList<Row>();
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                int numCols = md.getColumnCount();
                while (rs.next()) {
                    Map<String,String> values =
                        new LinkedHashMap<String,String>();
                    for (int col = 1; col <= numCols; ++col)
                        values.put(md.getColumnLabel(col), rs.getString(col));
                    rows.add(new Row(values));
                }
            }
            return Optional.<List<Row>>of(rows);
        } catch (SQLException sqle) {
            throw new StoreException("Failed to execute " + sql + " "
                                     + params, sqle);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override public boolean hasTable(Language language, String table) {
        return resolveTable(language, table) != null;
    }

    /**
     * Closes every open connection.
     *
     * @throws StoreException if any connection fails to close; the remaining
     *         connections are still closed
     */
    @Override public void close() {
        SQLException failure = null;
        for (Connection conn : connections.values()) {
            try {
                conn.close();
            } catch (SQLException sqle) {
                if (failure == null)
                    failure = sqle;
                else
                    failure.addSuppressed(sqle);
            }
        }
        connections.clear();
        sqlTableNames.clear();
        if (failure != null)
            throw new StoreException("Failed to close " + dbDir, failure);
    }

    /**
     * Returns the SQL name of the language's table, or {@code null} if its
     * database file is missing or does not contain it.
     */
    private String resolveTable(Language language, String table) {
        String prefixed = language.getCode() + "_" + table;
        if (sqlTableNames.containsKey(prefixed))
            return sqlTableNames.get(prefixed);

        String resolved = null;
        File dbFile = getDatabaseFile(language, table);
        if (dbFile.isFile()) {
            Connection conn = connect(dbFile);
            if (containsTable(conn, prefixed))
                resolved = prefixed;
            else if (containsTable(conn, table))
                resolved = table;
        }
        if (resolved == null) {
            MwnLogger.verbose("No table %s in %s; treating it as empty",
                              prefixed, dbFile);
        }
        sqlTableNames.put(prefixed, resolved);
        return resolved;
    }

    private static boolean containsTable(Connection conn, String name) {
        String sql = "SELECT name FROM sqlite_master "
            + "WHERE type='table' AND name=?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException sqle) {
            throw new StoreException("Failed to read the schema", sqle);
        }
    }

    private Connection connect(File dbFile) {
        Connection conn = connections.get(dbFile);
        if (conn == null) {
            Properties props = new Properties();
            props.setProperty("open_mode", READ_ONLY_OPEN_MODE);
            try {
                conn = DriverManager.getConnection(
                    "jdbc:sqlite:" + dbFile.getAbsolutePath(), props);
            } catch (SQLException sqle) {
                throw new StoreException("Cannot open " + dbFile, sqle);
            }
            connections.put(dbFile, conn);
        }
        return conn;
    }

    /**
     * Appends the SQL for one condition.  {@code instr} and {@code substr} are
     * used instead of {@code LIKE} so that matching stays case-sensitive and
     * the value needs no escaping.
     */
    private static void appendCondition(StringBuilder sql, List<String> params,
                                        Query.Condition c) {
        String col = quote(c.getColumn());
        switch (c.getMatch()) {
        case EXACT:
            sql.append(col).append(" = ?");
            params.add(c.getValue());
            break;
        case STARTS_WITH:
            sql.append("instr(").append(col).append(", ?) = 1");
            params.add(c.getValue());
            break;
        case ENDS_WITH:
            sql.append("substr(").append(col).append(", -length(?)) = ?");
            params.add(c.getValue());
            params.add(c.getValue());
            break;
        default:
            sql.append("instr(").append(col).append(", ?) > 0");
            params.add(c.getValue());
            break;
        }
    }

    private static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
