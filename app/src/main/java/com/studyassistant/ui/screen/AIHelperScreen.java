package com.studyassistant.ui.screen;

import com.studyassistant.entity.AIContent;
import com.studyassistant.service.AIContentService;
import com.studyassistant.service.ai.AIGateway;
import com.studyassistant.service.ai.AiMode;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.AsyncAiCall;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Explain a topic, summarize a text or generate practice questions, with
 * the option to keep the answer in the Review Hub.
 */
@Component
@RequiredArgsConstructor
public class AIHelperScreen implements ScreenHandler {

    private static final List<AiMode> MODES = List.of(AiMode.EXPLAIN, AiMode.SUMMARIZE, AiMode.PRACTICE_QUESTIONS);

    private final ScreenSupport support;
    private final AIGateway aiGateway;
    private final AIContentService aiContentService;
    private final AsyncAiCall asyncAiCall;

    @Override
    public Screen screen() {
        return Screen.AI_HELPER;
    }

    @Override
    public void show() {
        Session session = support.session();
        while (true) {
            int choice = support.choose(Screen.AI_HELPER.getTitle(),
                    List.of("Explain a topic", "Summarize a text", "Practice questions"), "Back");
            if (choice == 0) {
                support.navigation().back();
                return;
            }
            AiMode mode = MODES.get(choice - 1);
            support.attempt(() -> ask(session, mode));
        }
    }

    private void ask(Session session, AiMode mode) {
        ConsoleIO io = support.io();
        String input = mode == AiMode.SUMMARIZE
                ? io.readMultiline("Paste the text to summarize")
                : io.readLine("Topic");

        Optional<String> answer = asyncAiCall.await("Asking Gemini", () -> aiGateway.ask(session, input, mode));
        if (answer.isEmpty()) {
            return;
        }

        io.println();
        io.println(answer.get());
        io.println();
        if (io.confirm("Save to the Review Hub?")) {
            AIContent saved = aiContentService.save(session, mode.getContentKind(), null, input, answer.get());
            io.println("Saved as '" + saved.getTitle() + "'.");
        }
    }
}
