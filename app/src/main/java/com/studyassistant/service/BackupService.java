package com.studyassistant.service;

import com.studyassistant.exception.StoreException;
import com.studyassistant.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Backup and restore of the local database file.
 *
 * Export copies the database file as it is. Restore first checks the
 * candidate file on its own read-only connection:
 * 1. It starts with the SQLite header
 * 2. {@code PRAGMA integrity_check} reports ok
 * 3. Every application table exists with at least the columns of the
 *    live table
 * and only then replaces the live database with SQLite's online restore on
 * the pooled connection. A rejected file leaves the current data untouched.
 * The caller logs the user out after a restore.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackupService {

    static final List<String> REQUIRED_TABLES = List.of(
            "users", "categories", "tasks", "study_logs", "quiz_results",
            "ai_content", "chat_messages", "settings");

    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private final Path databaseFile;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Copy the database to a file chosen by the user.
     *
     * @param target destination file; replaced if it exists
     * @return the written file
     * @throws StoreException if the file cannot be written
     */
    public Path exportTo(Path target) {
        Path destination = requirePath(target).toAbsolutePath().normalize();
        if (destination.equals(databaseFile)) {
            throw new ValidationException("backup file", "Choose a file other than the live database.");
        }
        try {
            Path parent = destination.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(databaseFile, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw StoreException.backupFailed(destination.toString(), e);
        }
        log.info("Database exported to {}", destination);
        return destination;
    }

    /**
     * Replace the live database with a backup.
     *
     * @param source the backup file
     * @throws StoreException if the file is not a valid backup or the restore fails
     */
    public void restoreFrom(Path source) {
        Path candidate = requirePath(source).toAbsolutePath().normalize();
        if (candidate.equals(databaseFile)) {
            throw new ValidationException("backup file", "Choose a backup file, not the live database.");
        }
        if (candidate.toString().contains("'") && candidate.toString().contains("\"")) {
            throw new ValidationException("backup file",
                    "The path may contain single or double quotes, but not both.");
        }
        validateBackup(candidate);

        try {
            jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                try (Statement statement = connection.createStatement()) {
                    statement.executeUpdate("restore from " + quote(candidate.toString()));
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw StoreException.restoreFailed(candidate.toString(), e);
        }
        log.warn("Database restored from {}", candidate);
    }

    /**
     * Check that a file is a readable backup of this application.
     *
     * @throws StoreException describing the first problem found
     */
    void validateBackup(Path candidate) {
        String name = candidate.toString();
        if (!Files.isRegularFile(candidate)) {
            throw StoreException.invalidBackup(name, "file not found");
        }
        if (!hasSqliteHeader(candidate)) {
            throw StoreException.invalidBackup(name, "not an SQLite database");
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try (Connection connection = config.createConnection("jdbc:sqlite:" + candidate);
             Statement statement = connection.createStatement()) {

            try (ResultSet rs = statement.executeQuery("PRAGMA integrity_check")) {
                String result = rs.next() ? rs.getString(1) : null;
                if (!"ok".equalsIgnoreCase(result)) {
                    throw StoreException.invalidBackup(name, "integrity check failed (" + result + ")");
                }
            }

            Set<String> tables = new HashSet<>();
            try (ResultSet rs = statement.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
            }
            for (String required : REQUIRED_TABLES) {
                if (!tables.contains(required)) {
                    throw StoreException.invalidBackup(name, "missing table '" + required + "'");
                }
                Set<String> columns = new HashSet<>();
                try (ResultSet rs = statement.executeQuery("PRAGMA table_info(" + required + ")")) {
                    while (rs.next()) {
                        columns.add(rs.getString("name"));
                    }
                }
                for (String column : liveColumns(required)) {
                    if (!columns.contains(column)) {
                        throw StoreException.invalidBackup(name,
                                "table '" + required + "' is missing column '" + column + "'");
                    }
                }
            }
        } catch (SQLException e) {
            throw StoreException.invalidBackup(name, "cannot be opened (" + e.getMessage() + ")");
        }
        log.debug("Backup {} passed validation", candidate);
    }

    private List<String> liveColumns(String table) {
        return jdbcTemplate.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name"));
    }

    private static boolean hasSqliteHeader(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] header = in.readNBytes(SQLITE_HEADER.length);
            return Arrays.equals(header, SQLITE_HEADER);
        } catch (IOException e) {
            throw StoreException.invalidBackup(file.toString(), "cannot be read (" + e.getMessage() + ")");
        }
    }

    private static Path requirePath(Path path) {
        if (path == null || path.toString().isBlank()) {
            throw ValidationException.blank("file path");
        }
        return path;
    }

    private static String quote(String path) {
        return path.contains("'") ? "\"" + path + "\"" : "'" + path + "'";
    }
}
