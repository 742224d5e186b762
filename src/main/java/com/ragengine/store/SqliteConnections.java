package com.ragengine.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteConnections {
    private static final Logger log = LoggerFactory.getLogger(SqliteConnections.class);

    private SqliteConnections() {
    }

    public static Connection openForWrite(Path dbPath, String purpose) {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RagStoreException("Cannot create directory for RAG database '" + dbPath + "'", e);
        }
        return open(dbPath, purpose);
    }

    public static Connection openExisting(Path dbPath, String purpose) {
        if (!Files.isRegularFile(dbPath)) {
            throw new RagStoreException("RAG database '" + dbPath + "' does not exist");
        }
        return open(dbPath, purpose);
    }

    private static Connection open(Path dbPath, String purpose) {
        String name = purpose + "_" + UUID.randomUUID().toString().replace("-", "");
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute(FragmentSchema.PRAGMA_FOREIGN_KEYS);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            log.debug("Opened connection {} to {}", name, dbPath);
            return connection;
        } catch (SQLException e) {
            throw new RagStoreException("Failed to open RAG database '" + dbPath + "': " + e.getMessage(), e);
        }
    }
}
