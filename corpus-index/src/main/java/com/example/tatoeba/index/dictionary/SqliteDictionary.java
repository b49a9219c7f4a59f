package com.example.tatoeba.index.dictionary;

import com.example.tatoeba.index.CorpusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dictionary backed by a SQLite table of {@code (headword, sense, reading)} rows.
 *
 * <p>Lookups are cached per headword, including misses. The connection stays open until
 * {@link #close()}.</p>
 */
public final class SqliteDictionary implements Dictionary, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDictionary.class);

    static final String TABLE = "dictionary_readings";

    private static final Optional<DictionaryEntry> MISSING = Optional.empty();

    private final Path databasePath;
    private final Connection connection;
    private final PreparedStatement lookup;
    private final Map<String, Optional<DictionaryEntry>> cache = new ConcurrentHashMap<>();

    private SqliteDictionary(Path databasePath, Connection connection, PreparedStatement lookup) {
        this.databasePath = databasePath;
        this.connection = connection;
        this.lookup = lookup;
    }

    /**
     * Opens an existing dictionary database.
     *
     * @throws CorpusException when the file is missing or the table cannot be queried
     */
    public static SqliteDictionary open(Path databasePath) {
        Objects.requireNonNull(databasePath, "databasePath");
        if (!Files.isRegularFile(databasePath)) {
            throw new CorpusException("Dictionary file not found: " + databasePath.toAbsolutePath());
        }
        Connection connection = null;
        try {
            connection = DriverManager.getConnection(jdbcUrl(databasePath));
            PreparedStatement statement = connection.prepareStatement(
                    "SELECT reading FROM " + TABLE + " WHERE headword = ? ORDER BY sense");
            LOG.info("Opened dictionary {}", databasePath.toAbsolutePath());
            return new SqliteDictionary(databasePath, connection, statement);
        } catch (SQLException ex) {
            closeQuietly(connection, ex);
            throw new CorpusException("Failed to open dictionary " + databasePath.toAbsolutePath(), ex);
        }
    }

    /**
     * Writes entries into a dictionary database, replacing whatever the table held before.
     * Senses are numbered from 1 in reading order.
     *
     * @return number of reading rows stored
     */
    public static int write(Path databasePath, Collection<DictionaryEntry> entries) throws IOException, SQLException {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(entries, "entries");
        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int rows = 0;
        try (Connection connection = DriverManager.getConnection(jdbcUrl(databasePath))) {
            initialiseDatabase(connection);
            connection.setAutoCommit(false);
            try {
                try (Statement statement = connection.createStatement()) {
                    statement.executeUpdate("DELETE FROM " + TABLE);
                }
                String sql = "INSERT INTO " + TABLE + " (headword, sense, reading) VALUES (?,?,?)";
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    for (DictionaryEntry entry : entries) {
                        int sense = 1;
                        for (String reading : entry.readings()) {
                            statement.setString(1, entry.headword());
                            statement.setInt(2, sense++);
                            statement.setString(3, reading);
                            statement.addBatch();
                            rows++;
                        }
                    }
                    statement.executeBatch();
                }
                connection.commit();
            } catch (SQLException ex) {
                connection.rollback();
                throw ex;
            }
        }
        LOG.info("Stored {} readings for {} headwords in {}", rows, entries.size(), databasePath.toAbsolutePath());
        return rows;
    }

    private static void initialiseDatabase(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                    + "headword TEXT NOT NULL,"
                    + "sense INTEGER NOT NULL,"
                    + "reading TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_" + TABLE + "_headword ON " + TABLE + "(headword)");
        }
    }

    @Override
    public Optional<DictionaryEntry> lookup(String headword) {
        if (headword == null || headword.isEmpty()) {
            return MISSING;
        }
        Optional<DictionaryEntry> cached = cache.get(headword);
        if (cached != null) {
            return cached;
        }
        Optional<DictionaryEntry> loaded = query(headword);
        cache.put(headword, loaded);
        return loaded;
    }

    private synchronized Optional<DictionaryEntry> query(String headword) {
        try {
            lookup.setString(1, headword);
            List<String> readings = new ArrayList<>();
            try (ResultSet rs = lookup.executeQuery()) {
                while (rs.next()) {
                    readings.add(rs.getString(1));
                }
            }
            return readings.isEmpty() ? MISSING : Optional.of(new DictionaryEntry(headword, readings));
        } catch (SQLException ex) {
            throw new CorpusException("Dictionary lookup failed for " + headword + " in " + databasePath, ex);
        }
    }

    @Override
    public void close() throws IOException {
        try (Connection ignored = connection; PreparedStatement statement = lookup) {
            cache.clear();
        } catch (SQLException ex) {
            throw new IOException("Failed to close dictionary " + databasePath, ex);
        }
    }

    private static void closeQuietly(Connection connection, SQLException failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException ex) {
            failure.addSuppressed(ex);
        }
    }

    private static String jdbcUrl(Path databasePath) {
        return "jdbc:sqlite:" + databasePath.toAbsolutePath();
    }
}
