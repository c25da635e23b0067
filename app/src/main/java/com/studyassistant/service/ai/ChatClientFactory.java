package com.studyassistant.service.ai;

import org.springframework.ai.chat.client.ChatClient;

/**
 * Builds a chat client bound to one user's API key.
 */
@FunctionalInterface
public interface ChatClientFactory {

    ChatClient create(String apiKey);
}
