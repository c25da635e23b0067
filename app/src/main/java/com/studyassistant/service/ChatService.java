package com.studyassistant.service;

import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import com.studyassistant.entity.ChatMessage;
import com.studyassistant.entity.ChatMessage.Role;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.ChatMessageRepository;
import com.studyassistant.service.ai.AIGateway;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persistent AI chat.
 *
 * The most recent messages are the conversation history sent with each new
 * message. A turn is stored only once the model has answered, so a failed
 * request leaves the history unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatService {

    private final ChatMessageRepository chatMessageRepository;
    private final AIGateway aiGateway;
    private final AIContentService aiContentService;

    @Value("${app.ai.chat-history-limit:50}")
    private int historyLimit;

    /**
     * The most recent messages, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> history(Session session) {
        List<ChatMessage> newestFirst = chatMessageRepository.findByOwnerIdOrderByIdDesc(
                session.getUserId(), PageRequest.of(0, historyLimit));
        List<ChatMessage> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    /**
     * Send a message and store both sides of the exchange.
     *
     * @param session the active session
     * @param message the user's message
     * @return the model's reply
     */
    public String send(Session session, String message) {
        if (message == null || message.trim().isEmpty()) {
            throw ValidationException.blank("message");
        }
        String text = message.trim();
        String reply = aiGateway.converse(session, history(session), text);

        chatMessageRepository.saveAll(List.of(
                new ChatMessage(session.getUserId(), Role.USER, text),
                new ChatMessage(session.getUserId(), Role.MODEL, reply)));
        return reply;
    }

    /**
     * Delete the whole chat history of the user.
     *
     * @return the number of messages removed
     */
    @Transactional
    public int clear(Session session) {
        int removed = chatMessageRepository.deleteByOwner(session.getUserId());
        log.info("Cleared {} chat message(s) for user {}", removed, session.getUserId());
        return removed;
    }

    /**
     * Save the current conversation to the archive as a chat snapshot.
     *
     * @return the archived entry
     * @throws ValidationException if there is nothing to save
     */
    @Transactional
    public AIContent snapshot(Session session) {
        List<ChatMessage> messages = history(session);
        if (messages.isEmpty()) {
            throw new ValidationException("chat", "There is no conversation to save yet.");
        }
        StringBuilder transcript = new StringBuilder();
        for (ChatMessage chatMessage : messages) {
            transcript.append(chatMessage.getRole() == Role.USER ? "You: " : "AI: ")
                    .append(chatMessage.getContent())
                    .append(System.lineSeparator());
        }
        String opening = messages.get(0).getContent();
        return aiContentService.save(session, ContentKind.CHAT_SNAPSHOT, null, opening, transcript.toString());
    }
}
