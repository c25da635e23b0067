package com.studyassistant.service;

import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.repository.AIContentRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Archive of AI answers the user chose to keep, shown in the Review Hub.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AIContentService {

    static final int TITLE_MAX_LENGTH = 60;

    private final AIContentRepository aiContentRepository;

    /**
     * Save an AI answer.
     *
     * @param title display title; when blank, derived from the prompt
     */
    @Transactional
    public AIContent save(Session session, ContentKind kind, String title, String prompt, String responseText) {
        if (kind == null) {
            throw new IllegalArgumentException("Content kind is required");
        }
        String normalizedPrompt = InputRules.requireText(prompt, "prompt", Integer.MAX_VALUE);
        String response = InputRules.requireText(responseText, "response", Integer.MAX_VALUE);
        String effectiveTitle = InputRules.optionalText(title);
        if (effectiveTitle == null) {
            effectiveTitle = deriveTitle(normalizedPrompt);
        }

        AIContent saved = aiContentRepository.save(
                new AIContent(session.getUserId(), kind, effectiveTitle, normalizedPrompt, response));
        log.info("Saved {} '{}' (ID: {}) for user {}", kind, effectiveTitle, saved.getId(), session.getUserId());
        return saved;
    }

    /**
     * List saved content, newest first.
     *
     * @param kind only this kind; null for all
     */
    @Transactional(readOnly = true)
    public List<AIContent> list(Session session, ContentKind kind) {
        if (kind == null) {
            return aiContentRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(session.getUserId());
        }
        return aiContentRepository.findByOwnerIdAndKindOrderByCreatedAtDescIdDesc(session.getUserId(), kind);
    }

    @Transactional(readOnly = true)
    public AIContent get(Session session, Long contentId) {
        return aiContentRepository.findByIdAndOwnerId(contentId, session.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.content(contentId));
    }

    @Transactional
    public void delete(Session session, Long contentId) {
        AIContent content = get(session, contentId);
        aiContentRepository.delete(content);
        log.info("Deleted AI content {} for user {}", contentId, session.getUserId());
    }

    static String deriveTitle(String prompt) {
        String firstLine = prompt.strip().split("\\R", 2)[0].strip();
        if (firstLine.length() <= TITLE_MAX_LENGTH) {
            return firstLine;
        }
        return firstLine.substring(0, TITLE_MAX_LENGTH - 3).stripTrailing() + "...";
    }
}
