package com.studyassistant.ui.screen;

import com.studyassistant.exception.GlobalExceptionHandler;
import com.studyassistant.exception.UserFacingError;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.session.NavigationController;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleExitException;
import com.studyassistant.ui.ConsoleIO;
import com.studyassistant.ui.ScreenAbortedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collaborators and helpers shared by the screen handlers.
 */
@Component
@RequiredArgsConstructor
public class ScreenSupport {

    private final ConsoleIO io;
    private final NavigationController navigation;
    private final GlobalExceptionHandler exceptionHandler;

    public ConsoleIO io() {
        return io;
    }

    public NavigationController navigation() {
        return navigation;
    }

    public Session session() {
        return navigation.requireSession();
    }

    /**
     * Show a menu until a valid option is chosen.
     */
    public int choose(String title, List<String> options, String zeroLabel) {
        while (true) {
            io.header(title);
            try {
                return io.menu(options, zeroLabel);
            } catch (ValidationException e) {
                io.error(exceptionHandler.handle(e));
            }
        }
    }

    /**
     * Run one user action. Recoverable errors are shown and the user stays
     * on the screen; errors that require leaving the screen are rethrown as
     * {@link ScreenAbortedException}.
     *
     * @return true if the action completed
     */
    public boolean attempt(Runnable action) {
        try {
            action.run();
            return true;
        } catch (ConsoleExitException | ScreenAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            UserFacingError error = exceptionHandler.handle(e);
            if (error.isReturnToMainMenu()) {
                throw new ScreenAbortedException(error, e);
            }
            io.error(error);
            return false;
        }
    }
}
