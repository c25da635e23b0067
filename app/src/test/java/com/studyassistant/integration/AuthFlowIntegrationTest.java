package com.studyassistant.integration;

import com.studyassistant.entity.Category;
import com.studyassistant.entity.User;
import com.studyassistant.exception.DuplicateUsernameException;
import com.studyassistant.exception.InvalidCredentialsException;
import com.studyassistant.service.CategoryService;
import com.studyassistant.session.NavigationController;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for registration, login and logout through the
 * navigation controller.
 */
@DisplayName("Authentication Flow Integration Tests")
class AuthFlowIntegrationTest extends AbstractStoreIntegrationTest {

    @Autowired
    private NavigationController navigation;

    @Autowired
    private CategoryService categoryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void tearDown() {
        navigation.logout();
    }

    @Test
    @DisplayName("Register, log in with the right password and log out")
    void testRegisterLoginLogout() {
        // Arrange
        String username = uniqueName("alice");
        navigation.register(username, "pw1");

        // Act
        Session session = navigation.login(username, "pw1");

        // Assert
        assertEquals(Screen.MAIN_MENU, navigation.getCurrentScreen());
        assertEquals(username, session.getUsername());

        navigation.logout();
        assertEquals(Screen.LOGGED_OUT, navigation.getCurrentScreen());
        assertTrue(navigation.getSession().isEmpty());
    }

    @Test
    @DisplayName("A wrong password or unknown user fails with the same error")
    void testInvalidCredentials() {
        String username = uniqueName("alice");
        navigation.register(username, "pw1");

        InvalidCredentialsException wrongPassword = assertThrows(InvalidCredentialsException.class,
                () -> navigation.login(username, "wrong"));
        InvalidCredentialsException unknownUser = assertThrows(InvalidCredentialsException.class,
                () -> navigation.login(uniqueName("nobody"), "pw1"));

        assertEquals(wrongPassword.getMessage(), unknownUser.getMessage());
        assertEquals(Screen.LOGGED_OUT, navigation.getCurrentScreen());
    }

    @Test
    @DisplayName("A taken username cannot be registered again")
    void testDuplicateUsername() {
        String username = uniqueName("alice");
        navigation.register(username, "pw1");

        assertThrows(DuplicateUsernameException.class, () -> navigation.register(username, "other"));
        Integer users = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE username = ?", Integer.class, username);
        assertEquals(1, users);
    }

    @Test
    @DisplayName("New accounts start with the five default categories")
    void testDefaultCategories() {
        String username = uniqueName("carol");
        navigation.register(username, "pw1");
        Session session = navigation.login(username, "pw1");

        List<String> names = categoryService.list(session).stream()
                .map(Category::getName)
                .collect(Collectors.toList());

        assertEquals(List.of("Academic", "General", "Personal", "Project", "Urgent"), names);
    }

    @Test
    @DisplayName("Passwords are stored as BCrypt hashes and can be changed")
    void testChangePassword() {
        String username = uniqueName("dave");
        User user = authService.register(username, "first");
        String hash = jdbcTemplate.queryForObject(
                "SELECT password_hash FROM users WHERE id = ?", String.class, user.getId());
        assertNotEquals("first", hash);
        assertTrue(hash.startsWith("$2"));

        Session session = navigation.login(username, "first");
        assertThrows(InvalidCredentialsException.class,
                () -> authService.changePassword(session, "wrong", "second"));
        authService.changePassword(session, "first", "second");
        navigation.logout();

        assertThrows(InvalidCredentialsException.class, () -> navigation.login(username, "first"));
        assertEquals(username, navigation.login(username, "second").getUsername());
    }
}
