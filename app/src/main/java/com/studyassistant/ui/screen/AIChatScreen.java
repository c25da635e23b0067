package com.studyassistant.ui.screen;

import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.ChatMessage;
import com.studyassistant.service.ChatService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.AsyncAiCall;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Free-form chat with the assistant. The stored history is shown on entry.
 */
@Component
@RequiredArgsConstructor
public class AIChatScreen implements ScreenHandler {

    private final ScreenSupport support;
    private final ChatService chatService;
    private final AsyncAiCall asyncAiCall;

    @Override
    public Screen screen() {
        return Screen.AI_CHAT;
    }

    @Override
    public void show() {
        ConsoleIO io = support.io();
        Session session = support.session();

        io.header(Screen.AI_CHAT.getTitle());
        support.attempt(() -> printHistory(chatService.history(session)));
        io.println("Commands: /save keeps this conversation, /clear deletes the history, /back returns.");

        while (true) {
            String input = io.readLine("You");
            if (input.isEmpty()) {
                continue;
            }
            switch (input.toLowerCase()) {
                case "/back":
                    support.navigation().back();
                    return;
                case "/clear":
                    support.attempt(() -> {
                        if (io.confirm("Delete the whole chat history?")) {
                            chatService.clear(session);
                            io.println("History cleared.");
                        }
                    });
                    break;
                case "/save":
                    support.attempt(() -> {
                        AIContent saved = chatService.snapshot(session);
                        io.println("Conversation saved as '" + saved.getTitle() + "'.");
                    });
                    break;
                default:
                    support.attempt(() -> asyncAiCall.await("Thinking", () -> chatService.send(session, input))
                            .ifPresent(reply -> io.println("AI: " + reply)));
                    break;
            }
        }
    }

    private void printHistory(List<ChatMessage> history) {
        ConsoleIO io = support.io();
        for (ChatMessage message : history) {
            io.println((message.getRole() == ChatMessage.Role.USER ? "You: " : "AI: ") + message.getContent());
        }
    }
}
