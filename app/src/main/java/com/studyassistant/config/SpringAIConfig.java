package com.studyassistant.config;

import com.studyassistant.service.ai.ChatClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Spring AI configuration for the Gemini chat model.
 *
 * Gemini is reached through its OpenAI-compatible endpoint, so the OpenAI
 * chat model from Spring AI is used with the base URL overridden. Unlike a
 * server application the API key is not known at startup: each user enters
 * their own in Settings. This class therefore exposes a
 * {@link ChatClientFactory} that builds a ChatClient for a given key, and
 * the AI gateway caches one client per user.
 *
 * Configuration Details:
 * - Base URL: {@code app.ai.base-url} (Gemini OpenAI-compatible endpoint)
 * - Model: {@code app.ai.model}
 * - Timeout: {@code app.ai.timeout-seconds}, for both connect and read
 * - Retries: disabled; a failed request is reported to the user, who may retry
 *
 * Usage:
 * <pre>{@code
 * ChatClient client = chatClientFactory.create(apiKey);
 * String answer = client.prompt()
 *     .system("You are a patient tutor.")
 *     .user("Explain photosynthesis")
 *     .call()
 *     .content();
 * }</pre>
 *
 * @see com.studyassistant.service.ai.AIGateway
 */
@Configuration
@Slf4j
public class SpringAIConfig {

    @Value("${app.ai.base-url}")
    private String baseUrl;

    @Value("${app.ai.completions-path:/chat/completions}")
    private String completionsPath;

    @Value("${app.ai.model}")
    private String model;

    @Value("${app.ai.timeout-seconds:30}")
    private long timeoutSeconds;

    @Value("${app.ai.temperature:0.7}")
    private double temperature;

    /**
     * Factory for per-key Gemini chat clients.
     *
     * @return the factory used by the AI gateway
     */
    @Bean
    public ChatClientFactory chatClientFactory() {
        log.info("Configuring Gemini chat clients: model={}, baseUrl={}, timeout={}s",
                model, baseUrl, timeoutSeconds);
        return apiKey -> ChatClient.create(geminiChatModel(apiKey));
    }

    private OpenAiChatModel geminiChatModel(String apiKey) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        OpenAiApi geminiApi = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .completionsPath(completionsPath)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(geminiApi)
                .defaultOptions(options)
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
