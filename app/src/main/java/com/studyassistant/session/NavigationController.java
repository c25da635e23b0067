package com.studyassistant.session;

import com.studyassistant.entity.User;
import com.studyassistant.service.AuthService;
import com.studyassistant.service.ai.AIGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the current session and the active screen.
 *
 * The screens form a small state machine with an explicit transition table:
 * <pre>
 * LOGGED_OUT  --login-->  MAIN_MENU
 * MAIN_MENU   --open--->  TASK_MANAGER | STUDY_TRACKER | AI_HELPER | AI_QUIZ
 *                         | AI_CHAT | ANALYTICS | REVIEW_HUB | SETTINGS
 * (feature)   --back--->  MAIN_MENU
 * (any)       --logout->  LOGGED_OUT
 * </pre>
 * LOGGED_OUT is left only through a successful {@link #login}; every other
 * screen requires a session. Logout drops the session and the AI gateway's
 * cached API key.
 *
 * The session is written only at login and logout, from the interactive
 * thread; background AI calls read it through {@link #requireSession()}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NavigationController {

    private static final Map<Screen, Set<Screen>> TRANSITIONS = buildTransitions();

    private final AuthService authService;
    private final AIGateway aiGateway;
    private final Clock clock;

    private volatile Screen currentScreen = Screen.LOGGED_OUT;
    private volatile Session session;

    private static Map<Screen, Set<Screen>> buildTransitions() {
        Map<Screen, Set<Screen>> table = new EnumMap<>(Screen.class);
        table.put(Screen.LOGGED_OUT, EnumSet.of(Screen.MAIN_MENU));
        table.put(Screen.MAIN_MENU, EnumSet.of(
                Screen.TASK_MANAGER, Screen.STUDY_TRACKER, Screen.AI_HELPER, Screen.AI_QUIZ,
                Screen.AI_CHAT, Screen.ANALYTICS, Screen.REVIEW_HUB, Screen.SETTINGS));
        for (Screen feature : EnumSet.range(Screen.TASK_MANAGER, Screen.SETTINGS)) {
            table.put(feature, EnumSet.of(Screen.MAIN_MENU));
        }
        return Collections.unmodifiableMap(table);
    }

    /**
     * Whether the table allows moving from one screen to another.
     *
     * @param from the current screen
     * @param to the requested screen
     * @return true if the transition is in the table
     */
    public static boolean isAllowed(Screen from, Screen to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public Screen getCurrentScreen() {
        return currentScreen;
    }

    public Optional<Session> getSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Get the active session.
     *
     * @return the session
     * @throws IllegalStateException if nobody is logged in
     */
    public Session requireSession() {
        Session current = session;
        if (current == null) {
            throw new IllegalStateException("No user is logged in");
        }
        return current;
    }

    /**
     * Authenticate and move from LOGGED_OUT to MAIN_MENU.
     *
     * @param username the username
     * @param password the plaintext password
     * @return the new session
     * @throws com.studyassistant.exception.InvalidCredentialsException on a bad username/password
     * @throws IllegalStateException if a user is already logged in
     */
    public Session login(String username, String password) {
        if (currentScreen != Screen.LOGGED_OUT) {
            throw new IllegalStateException("Already logged in as " + requireSession().getUsername());
        }
        User user = authService.authenticate(username, password);
        session = new Session(user.getId(), user.getUsername(), LocalDateTime.now(clock));
        transition(Screen.MAIN_MENU);
        log.info("Session started for user {} (ID: {})", user.getUsername(), user.getId());
        return session;
    }

    /**
     * Register a new account. The user stays on LOGGED_OUT and logs in next.
     *
     * @param username the requested username
     * @param password the plaintext password
     */
    public void register(String username, String password) {
        if (currentScreen != Screen.LOGGED_OUT) {
            throw new IllegalStateException("Log out before registering a new account");
        }
        authService.register(username, password);
    }

    /**
     * Open a feature screen from the main menu.
     *
     * @param target the screen to open
     * @throws IllegalStateException if the transition is not allowed
     */
    public void open(Screen target) {
        transition(target);
    }

    /**
     * Leave a feature screen for the main menu.
     */
    public void back() {
        transition(Screen.MAIN_MENU);
    }

    /**
     * Return to the main menu from wherever the user is, used after a store
     * error. Without a session this lands on LOGGED_OUT instead.
     */
    public void returnToMainMenu() {
        currentScreen = session != null ? Screen.MAIN_MENU : Screen.LOGGED_OUT;
    }

    /**
     * End the session: forget the user and their cached API key, show LOGGED_OUT.
     */
    public void logout() {
        Session ended = session;
        session = null;
        currentScreen = Screen.LOGGED_OUT;
        if (ended != null) {
            aiGateway.evictCredentials(ended.getUserId());
            log.info("Session ended for user {} (ID: {})", ended.getUsername(), ended.getUserId());
        }
    }

    private void transition(Screen target) {
        if (!isAllowed(currentScreen, target)) {
            throw new IllegalStateException(
                    String.format("Cannot go from %s to %s", currentScreen, target));
        }
        if (target.requiresSession() && session == null) {
            throw new IllegalStateException(target + " requires a logged-in user");
        }
        log.debug("Screen {} -> {}", currentScreen, target);
        currentScreen = target;
    }
}
