package com.studyassistant.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyassistant.entity.ChatMessage;
import com.studyassistant.exception.AIServiceException;
import com.studyassistant.exception.MissingApiKeyException;
import com.studyassistant.exception.NetworkException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.service.SettingsService;
import com.studyassistant.service.SettingsService.ApiKeyChangedEvent;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The only component that talks to the Gemini API.
 *
 * Each request is one synchronous call, bounded by the HTTP timeout and
 * never retried. The gateway does not persist or cache answers; callers
 * decide whether to archive them.
 *
 * API key handling:
 * - The key is read from the user's settings on every call
 * - No key: MissingApiKeyException, before any client is built or any
 *   network activity happens
 * - Clients are cached per user together with the key they were built
 *   with; a changed key, logout or {@link ApiKeyChangedEvent} drops the entry
 *
 * Error mapping:
 * - Connection failure or timeout: NetworkException
 * - Error status from the API: AIServiceException with the API's message
 * - Unreadable or empty response: AIServiceException
 *
 * @see com.studyassistant.config.SpringAIConfig
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AIGateway {

    private static final String SERVICE_NAME = "Gemini";

    private final SettingsService settingsService;
    private final ChatClientFactory chatClientFactory;
    private final ObjectMapper objectMapper;

    private final Map<Long, CachedClient> clients = new ConcurrentHashMap<>();

    /**
     * Send one prompt in the given mode.
     *
     * @param session the active session; its user's API key is used
     * @param prompt the user's text
     * @param mode selects the system instruction
     * @return the model's answer, trimmed
     * @throws MissingApiKeyException if no API key is configured
     * @throws NetworkException if the API cannot be reached in time
     * @throws AIServiceException if the API reports an error or answers with nothing
     */
    public String ask(Session session, String prompt, AiMode mode) {
        if (prompt == null || prompt.trim().isEmpty()) {
            throw ValidationException.blank("prompt");
        }
        ChatClient client = clientFor(session.getUserId());

        log.info("Sending {} request for user {}", mode, session.getUserId());
        log.debug("Prompt length: {} characters", prompt.length());

        return call(() -> client.prompt()
                .system(mode.getSystemInstruction())
                .user(prompt.trim())
                .call()
                .content());
    }

    /**
     * Continue a chat: the earlier messages are sent as conversation history
     * followed by the new message.
     *
     * @param session the active session
     * @param history earlier messages, oldest first
     * @param message the new user message
     * @return the model's reply
     */
    public String converse(Session session, List<ChatMessage> history, String message) {
        if (message == null || message.trim().isEmpty()) {
            throw ValidationException.blank("message");
        }
        ChatClient client = clientFor(session.getUserId());

        List<Message> conversation = new ArrayList<>();
        for (ChatMessage previous : history) {
            if (previous.getRole() == ChatMessage.Role.USER) {
                conversation.add(new UserMessage(previous.getContent()));
            } else {
                conversation.add(new AssistantMessage(previous.getContent()));
            }
        }

        log.info("Sending chat message for user {} with {} message(s) of history",
                session.getUserId(), conversation.size());

        return call(() -> client.prompt()
                .system(AiMode.CHAT.getSystemInstruction())
                .messages(conversation)
                .user(message.trim())
                .call()
                .content());
    }

    /**
     * Forget the cached client of a user.
     *
     * @param userId the user whose credentials are dropped
     */
    public void evictCredentials(Long userId) {
        if (clients.remove(userId) != null) {
            log.debug("Evicted cached AI client for user {}", userId);
        }
    }

    /**
     * Forget every cached client, e.g. after the database was restored.
     */
    public void evictAll() {
        clients.clear();
    }

    @EventListener
    public void onApiKeyChanged(ApiKeyChangedEvent event) {
        evictCredentials(event.getUserId());
    }

    boolean hasCachedClient(Long userId) {
        return clients.containsKey(userId);
    }

    private ChatClient clientFor(Long userId) {
        String apiKey = settingsService.findApiKey(userId)
                .orElseThrow(() -> {
                    log.info("AI request refused for user {}: no API key configured", userId);
                    return new MissingApiKeyException();
                });

        CachedClient cached = clients.compute(userId, (id, existing) ->
                existing != null && existing.apiKey.equals(apiKey)
                        ? existing
                        : new CachedClient(apiKey, chatClientFactory.create(apiKey)));
        return cached.client;
    }

    private String call(CallSupplier request) {
        String content;
        try {
            content = request.get();
        } catch (ResourceAccessException e) {
            log.warn("Gemini unreachable: {}", e.getMessage());
            throw NetworkException.unreachable(SERVICE_NAME, e);
        } catch (NonTransientAiException | TransientAiException e) {
            log.warn("Gemini returned an error: {}", e.getMessage());
            throw AIServiceException.upstream(describeUpstreamError(e.getMessage()), e);
        } catch (RestClientException e) {
            log.warn("Gemini response could not be read: {}", e.getMessage());
            throw AIServiceException.upstream(e.getMessage(), e);
        }

        if (content == null || content.trim().isEmpty()) {
            log.warn("Gemini returned an empty response");
            throw AIServiceException.emptyResponse();
        }

        log.debug("Received response of {} characters", content.length());
        return content.trim();
    }

    /**
     * Pull the human-readable message out of an error body such as
     * {@code HTTP 400 - [{"error": {"code": 400, "message": "API key not valid."}}]}.
     * Falls back to the raw text when no JSON message is found.
     */
    String describeUpstreamError(String raw) {
        if (raw == null || raw.isBlank()) {
            return "no details";
        }
        int start = indexOfJson(raw);
        if (start < 0) {
            return raw;
        }
        try {
            JsonNode node = objectMapper.readTree(raw.substring(start));
            if (node.isArray() && node.size() > 0) {
                node = node.get(0);
            }
            String message = node.path("error").path("message").asText("");
            return message.isBlank() ? raw : message;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return raw;
        }
    }

    private static int indexOfJson(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }

    @FunctionalInterface
    private interface CallSupplier {
        String get();
    }

    private static final class CachedClient {
        private final String apiKey;
        private final ChatClient client;

        private CachedClient(String apiKey, ChatClient client) {
            this.apiKey = apiKey;
            this.client = client;
        }
    }
}
