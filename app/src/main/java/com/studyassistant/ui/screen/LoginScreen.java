package com.studyassistant.ui.screen;

import com.studyassistant.session.NavigationController;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleExitException;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Login and registration.
 */
@Component
@RequiredArgsConstructor
public class LoginScreen implements ScreenHandler {

    private final ScreenSupport support;

    @Override
    public Screen screen() {
        return Screen.LOGGED_OUT;
    }

    @Override
    public void show() {
        ConsoleIO io = support.io();
        NavigationController navigation = support.navigation();

        while (navigation.getCurrentScreen() == Screen.LOGGED_OUT) {
            int choice = support.choose("Welcome", List.of("Login", "Register"), "Exit");
            switch (choice) {
                case 1:
                    support.attempt(() -> {
                        String username = io.readLine("Username");
                        String password = io.readSecret("Password");
                        Session session = navigation.login(username, password);
                        io.println("Welcome back, " + session.getUsername() + "!");
                    });
                    break;
                case 2:
                    support.attempt(() -> {
                        String username = io.readLine("Choose a username");
                        String password = io.readSecret("Choose a password");
                        String repeated = io.readSecret("Repeat the password");
                        if (!password.equals(repeated)) {
                            io.println("The passwords do not match.");
                            return;
                        }
                        navigation.register(username, password);
                        io.println("Account created. You can log in now.");
                    });
                    break;
                default:
                    throw new ConsoleExitException("Exit chosen on the login screen");
            }
        }
    }
}
