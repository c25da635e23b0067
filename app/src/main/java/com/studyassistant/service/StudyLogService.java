package com.studyassistant.service;

import com.studyassistant.entity.StudyLog;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.repository.StudyLogRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Service for study sessions, logged manually or from a finished Pomodoro.
 *
 * Logs are immutable; the only change after creation is deletion.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StudyLogService {

    static final int MAX_DURATION_MINUTES = 24 * 60;
    private static final int SUBJECT_MAX_LENGTH = 200;

    private final StudyLogRepository studyLogRepository;
    private final Clock clock;

    /**
     * Record a study session.
     *
     * @param session the active session
     * @param subject what was studied
     * @param durationMinutes length of the session, 1..1440
     * @param notes optional notes
     * @param loggedAt when it happened; null means now
     * @return the stored log
     * @throws com.studyassistant.exception.ValidationException on blank subject or bad duration
     */
    @Transactional
    public StudyLog log(Session session, String subject, Integer durationMinutes, String notes, LocalDateTime loggedAt) {
        String normalizedSubject = InputRules.requireText(subject, "subject", SUBJECT_MAX_LENGTH);
        int minutes = InputRules.requireRange(durationMinutes, "duration", 1, MAX_DURATION_MINUTES);
        LocalDateTime when = (loggedAt != null ? loggedAt : LocalDateTime.now(clock)).truncatedTo(ChronoUnit.SECONDS);

        StudyLog saved = studyLogRepository.save(
                new StudyLog(session.getUserId(), normalizedSubject, minutes, InputRules.optionalText(notes), when));
        log.info("Logged {} minute(s) of '{}' for user {}", minutes, normalizedSubject, session.getUserId());
        return saved;
    }

    /**
     * List logs, newest first.
     *
     * @param limit maximum number of logs; null for all
     */
    @Transactional(readOnly = true)
    public List<StudyLog> list(Session session, Integer limit) {
        if (limit == null) {
            return studyLogRepository.findByOwnerIdOrderByLoggedAtDesc(session.getUserId());
        }
        return studyLogRepository.findByOwnerIdOrderByLoggedAtDesc(session.getUserId(),
                PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional
    public void delete(Session session, Long logId) {
        StudyLog studyLog = studyLogRepository.findByIdAndOwnerId(logId, session.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.studyLog(logId));
        studyLogRepository.delete(studyLog);
        log.info("Deleted study log {} for user {}", logId, session.getUserId());
    }
}
