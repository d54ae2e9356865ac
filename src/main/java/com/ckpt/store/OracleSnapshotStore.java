package com.ckpt.store;

import com.ckpt.shared.CkptConfig;

import com.google.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot store backed by an Oracle table:
 *
 * <pre>
 *   CREATE TABLE ckpt_blobs (
 *       bucket     VARCHAR2(128)  NOT NULL,
 *       blob_key   VARCHAR2(512)  NOT NULL,
 *       payload    BLOB           NOT NULL,
 *       updated_at NUMBER(19)     NOT NULL,
 *       PRIMARY KEY (bucket, blob_key)
 *   )
 * </pre>
 *
 * Each put is a single auto-committed MERGE, so readers never observe a
 * partially written payload.
 */
public class OracleSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(OracleSnapshotStore.class);

    // Binary collation keeps the zero-padded generations in creation order whatever NLS_SORT the session has
    static final String LIST_SQL = "SELECT blob_key FROM ckpt_blobs " +
            "WHERE bucket = ? AND blob_key LIKE ? ESCAPE '\\' " +
            "ORDER BY NLSSORT(blob_key, 'NLS_SORT=BINARY')";

    private final String jdbcUrl;
    private final String jdbcUsername;
    private final String jdbcPassword;
    private final String bucket;
    private Connection connection;

    @Inject
    public OracleSnapshotStore(CkptConfig config) {
        this.jdbcUrl = "jdbc:oracle:thin:@//" + config.getStoreHost() + ":" + config.getStorePort()
                + "/" + config.getStoreServiceName();
        this.jdbcUsername = config.getStoreUser();
        this.jdbcPassword = config.getStorePassword();
        this.bucket = config.getBucketName();
    }

    @Override
    public synchronized void initialize() {
        try {
            connection = DriverManager.getConnection(jdbcUrl, jdbcUsername, jdbcPassword);
            connection.setAutoCommit(true);
            log.info("Connected to Oracle snapshot store at {} (bucket={})", jdbcUrl, bucket);
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to initialize OracleSnapshotStore", e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                throw new SnapshotStoreException("Failed to close OracleSnapshotStore", e);
            }
        }
    }

    @Override
    public synchronized void put(String key, byte[] bytes) {
        String sql = "MERGE INTO ckpt_blobs b " +
                "USING (SELECT ? AS bucket, ? AS blob_key FROM dual) src " +
                "ON (b.bucket = src.bucket AND b.blob_key = src.blob_key) " +
                "WHEN MATCHED THEN UPDATE SET payload = ?, updated_at = ? " +
                "WHEN NOT MATCHED THEN INSERT (bucket, blob_key, payload, updated_at) " +
                "VALUES (src.bucket, src.blob_key, ?, ?)";
        long now = System.currentTimeMillis();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, bucket);
            ps.setString(2, key);
            ps.setBytes(3, bytes);
            ps.setLong(4, now);
            ps.setBytes(5, bytes);
            ps.setLong(6, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to write " + key, e);
        }
    }

    @Override
    public synchronized byte[] get(String key) {
        String sql = "SELECT payload FROM ckpt_blobs WHERE bucket = ? AND blob_key = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, bucket);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SnapshotNotFoundException(key);
                }
                return rs.getBytes("payload");
            }
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to read " + key, e);
        }
    }

    @Override
    public synchronized List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(LIST_SQL)) {
            ps.setString(1, bucket);
            ps.setString(2, escapeLike(prefix) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("blob_key"));
                }
            }
            return keys;
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to list " + prefix, e);
        }
    }

    @Override
    public synchronized void delete(String key) {
        String sql = "DELETE FROM ckpt_blobs WHERE bucket = ? AND blob_key = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, bucket);
            ps.setString(2, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new SnapshotStoreException("Failed to delete " + key, e);
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
