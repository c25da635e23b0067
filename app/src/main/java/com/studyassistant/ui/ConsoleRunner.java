package com.studyassistant.ui;

import com.studyassistant.session.NavigationController;
import com.studyassistant.session.Screen;
import com.studyassistant.ui.screen.ScreenHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The interactive loop: shows the handler of the current screen until the
 * user exits or the input closes.
 *
 * Disabled with {@code app.console.enabled=false}, which the tests use.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleRunner implements CommandLineRunner {

    private final Map<Screen, ScreenHandler> handlers = new EnumMap<>(Screen.class);
    private final NavigationController navigation;
    private final ConsoleIO io;

    public ConsoleRunner(List<ScreenHandler> screenHandlers, NavigationController navigation, ConsoleIO io) {
        for (ScreenHandler handler : screenHandlers) {
            handlers.put(handler.screen(), handler);
        }
        for (Screen screen : Screen.values()) {
            if (!handlers.containsKey(screen)) {
                throw new IllegalStateException("No console handler for screen " + screen);
            }
        }
        this.navigation = navigation;
        this.io = io;
    }

    @Override
    public void run(String... args) {
        log.info("Starting interactive console");
        io.println("AI Study Assistant");

        while (true) {
            Screen current = navigation.getCurrentScreen();
            try {
                handlers.get(current).show();
            } catch (ScreenAbortedException e) {
                io.error(e.getError());
                navigation.returnToMainMenu();
            } catch (ConsoleExitException e) {
                log.info("Console closed: {}", e.getMessage());
                break;
            }
        }

        navigation.logout();
        io.println("Goodbye.");
    }
}
