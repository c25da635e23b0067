package com.studyassistant.config;

import com.studyassistant.exception.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * DataSource for the local SQLite database file.
 *
 * One file per installation, at {@code app.store.path}. The pool holds a
 * single connection: SQLite allows one writer, and every repository call
 * goes through the same connection in turn. Foreign keys are switched on
 * for that connection so ownership and cascades are enforced by the store.
 *
 * The schema itself comes from {@code schema.sql} (CREATE ... IF NOT EXISTS),
 * run by Spring Boot's SQL initializer on every start.
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Value("${app.store.path}")
    private String storePath;

    @Bean
    public Path databaseFile() {
        return Paths.get(storePath).toAbsolutePath().normalize();
    }

    @Bean
    public DataSource dataSource(Path databaseFile) {
        ensureParentDirectory(databaseFile);
        log.info("Using local database at {}", databaseFile);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + databaseFile);
        config.setDriverClassName("org.sqlite.JDBC");
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setConnectionInitSql("PRAGMA foreign_keys = ON");
        config.setPoolName("StudyAssistantStore");
        return new HikariDataSource(config);
    }

    private void ensureParentDirectory(Path databaseFile) {
        Path dir = databaseFile.getParent();
        if (dir == null || Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Cannot create database directory " + dir, e);
        }
    }
}
