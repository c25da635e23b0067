package com.studyassistant.integration;

import com.studyassistant.entity.User;
import com.studyassistant.service.AuthService;
import com.studyassistant.session.Session;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Base class for tests that run against a real SQLite file.
 *
 * All subclasses share one application context and one database file in a
 * temporary directory, so every test registers its own users under unique
 * names.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
abstract class AbstractStoreIntegrationTest {

    static final Path STORE_DIR = createStoreDir();

    @Autowired
    protected AuthService authService;

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("app.store.path", () -> STORE_DIR.resolve("assistant-test.db").toString());
        registry.add("logging.file.name", () -> STORE_DIR.resolve("assistant-test.log").toString());
    }

    /**
     * Register a fresh user and open a session for it.
     */
    protected Session newSession(String prefix) {
        String username = uniqueName(prefix);
        User user = authService.register(username, "password1");
        return new Session(user.getId(), user.getUsername(), LocalDateTime.now());
    }

    protected static String uniqueName(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static Path createStoreDir() {
        try {
            return Files.createTempDirectory("study-assistant-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
