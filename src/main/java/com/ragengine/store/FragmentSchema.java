package com.ragengine.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class FragmentSchema {
    public static final String PRAGMA_FOREIGN_KEYS = "PRAGMA foreign_keys = ON";

    public static final String CREATE_SOURCE_FILES = """
            CREATE TABLE IF NOT EXISTS source_files (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_path TEXT UNIQUE NOT NULL,
                provider TEXT NOT NULL,
                model TEXT NOT NULL,
                last_modified INTEGER,
                metadata TEXT
            )
            """;

    public static final String CREATE_FRAGMENTS = """
            CREATE TABLE IF NOT EXISTS fragments (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_id INTEGER NOT NULL,
                chunk_index INTEGER NOT NULL,
                content TEXT NOT NULL,
                embedding BLOB,
                FOREIGN KEY (file_id) REFERENCES source_files(id) ON DELETE CASCADE
            )
            """;

    static final String UPSERT_SOURCE_FILE = """
            INSERT INTO source_files (file_path, provider, model, last_modified, metadata)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(file_path) DO UPDATE SET
                provider = excluded.provider,
                model = excluded.model,
                last_modified = excluded.last_modified,
                metadata = excluded.metadata
            """;

    static final String SELECT_SOURCE_FILE_ID = "SELECT id FROM source_files WHERE file_path = ?";
    static final String DELETE_FRAGMENTS_OF_FILE = "DELETE FROM fragments WHERE file_id = ?";
    static final String INSERT_FRAGMENT =
            "INSERT INTO fragments (file_id, chunk_index, content, embedding) VALUES (?, ?, ?, ?)";

    private FragmentSchema() {
    }

    public static void ensureSchema(Connection connection) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(PRAGMA_FOREIGN_KEYS);
            statement.execute(CREATE_SOURCE_FILES);
            statement.execute(CREATE_FRAGMENTS);
        } catch (SQLException e) {
            throw new SchemaException("Failed to create RAG schema: " + e.getMessage(), e);
        }
    }
}
