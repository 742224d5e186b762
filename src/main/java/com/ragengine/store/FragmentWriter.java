package com.ragengine.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public class FragmentWriter implements AutoCloseable {
    private final Connection connection;
    private PreparedStatement upsertFile;
    private PreparedStatement selectFileId;
    private PreparedStatement deleteFragments;
    private PreparedStatement insertFragment;

    public FragmentWriter(Connection connection) {
        this.connection = connection;
    }

    public void beginTransaction() {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new TransactionException("Failed to start transaction: " + e.getMessage(), e);
        }
    }

    public void commit() {
        try {
            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new TransactionException("Failed to commit transaction: " + e.getMessage(), e);
        }
    }

    public void rollback() {
        try {
            connection.rollback();
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new TransactionException("Failed to roll back transaction: " + e.getMessage(), e);
        }
    }

    public void clearAll() {
        beginTransaction();
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM fragments");
            statement.executeUpdate("DELETE FROM source_files");
            if (hasSequenceTable(statement)) {
                statement.executeUpdate("DELETE FROM sqlite_sequence WHERE name IN ('fragments', 'source_files')");
            }
        } catch (SQLException e) {
            TransactionException failure = new TransactionException("Failed to clear RAG database: " + e.getMessage(), e);
            try {
                rollback();
            } catch (TransactionException rollbackFailure) {
                failure.addSuppressed(rollbackFailure);
            }
            throw failure;
        }
        commit();
    }

    private static boolean hasSequenceTable(Statement statement) throws SQLException {
        try (ResultSet rs = statement.executeQuery(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = 'sqlite_sequence'")) {
            return rs.next();
        }
    }

    public long upsertSourceFile(String filePath, String provider, String model, long lastModified, String metadata)
            throws SQLException {
        if (upsertFile == null) {
            upsertFile = connection.prepareStatement(FragmentSchema.UPSERT_SOURCE_FILE);
            selectFileId = connection.prepareStatement(FragmentSchema.SELECT_SOURCE_FILE_ID);
        }
        upsertFile.setString(1, filePath);
        upsertFile.setString(2, provider);
        upsertFile.setString(3, model);
        upsertFile.setLong(4, lastModified);
        upsertFile.setString(5, metadata);
        upsertFile.executeUpdate();

        selectFileId.setString(1, filePath);
        try (ResultSet rs = selectFileId.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("No source_files row for " + filePath + " after upsert");
            }
            return rs.getLong(1);
        }
    }

    public int deleteFragments(long fileId) throws SQLException {
        if (deleteFragments == null) {
            deleteFragments = connection.prepareStatement(FragmentSchema.DELETE_FRAGMENTS_OF_FILE);
        }
        deleteFragments.setLong(1, fileId);
        return deleteFragments.executeUpdate();
    }

    public void insertFragment(long fileId, int chunkIndex, String content, float[] embedding) throws SQLException {
        if (insertFragment == null) {
            insertFragment = connection.prepareStatement(FragmentSchema.INSERT_FRAGMENT);
        }
        insertFragment.setLong(1, fileId);
        insertFragment.setInt(2, chunkIndex);
        insertFragment.setString(3, content);
        insertFragment.setBytes(4, EmbeddingCodec.encode(embedding));
        insertFragment.executeUpdate();
    }

    @Override
    public void close() throws SQLException {
        SQLException failure = null;
        for (PreparedStatement statement : new PreparedStatement[] { upsertFile, selectFileId, deleteFragments,
                insertFragment }) {
            if (statement == null) {
                continue;
            }
            try {
                statement.close();
            } catch (SQLException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
