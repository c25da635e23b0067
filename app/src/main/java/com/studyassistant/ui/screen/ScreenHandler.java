package com.studyassistant.ui.screen;

import com.studyassistant.session.Screen;

/**
 * Console rendering of one {@link Screen}.
 *
 * {@link #show()} runs the screen until the user leaves it, after which
 * {@link com.studyassistant.session.NavigationController#getCurrentScreen()}
 * names the next screen to show.
 */
public interface ScreenHandler {

    Screen screen();

    void show();
}
