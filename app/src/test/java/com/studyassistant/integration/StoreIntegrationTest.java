package com.studyassistant.integration;

import com.studyassistant.dto.request.TaskFilter;
import com.studyassistant.dto.request.TaskRequest;
import com.studyassistant.dto.response.AnalyticsReport;
import com.studyassistant.dto.response.AnsweredQuestion;
import com.studyassistant.dto.response.PomodoroDurations;
import com.studyassistant.dto.response.QuizQuestion;
import com.studyassistant.dto.response.QuizReview;
import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import com.studyassistant.entity.Category;
import com.studyassistant.entity.QuizResult;
import com.studyassistant.entity.Setting;
import com.studyassistant.entity.StudyLog;
import com.studyassistant.entity.Task;
import com.studyassistant.entity.Task.TaskStatus;
import com.studyassistant.exception.InvalidCredentialsException;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.service.AIContentService;
import com.studyassistant.service.AnalyticsService;
import com.studyassistant.service.CategoryService;
import com.studyassistant.service.QuizService;
import com.studyassistant.service.SettingsService;
import com.studyassistant.service.StudyLogService;
import com.studyassistant.service.TaskService;
import com.studyassistant.session.Session;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the services over the SQLite store.
 *
 * Covers persistence round trips, per-user isolation, quiz result checks,
 * category removal and the cascade on account deletion.
 */
@DisplayName("Store Integration Tests")
class StoreIntegrationTest extends AbstractStoreIntegrationTest {

    @Autowired
    private TaskService taskService;

    @Autowired
    private CategoryService categoryService;

    @Autowired
    private StudyLogService studyLogService;

    @Autowired
    private QuizService quizService;

    @Autowired
    private AIContentService aiContentService;

    @Autowired
    private SettingsService settingsService;

    @Autowired
    private AnalyticsService analyticsService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("A created task reads back with the same fields")
    void testTaskRoundTrip() {
        // Arrange
        Session session = newSession("tasks");
        Category biology = category(session, "Biology");
        LocalDate due = LocalDate.now().plusDays(3);

        // Act
        Task created = taskService.create(session, TaskRequest.builder()
                .title("Read chapter 4").categoryId(biology.getId()).dueDate(due).build());
        Task loaded = taskService.get(session, created.getId());

        // Assert
        assertEquals("Read chapter 4", loaded.getTitle());
        assertEquals(biology.getId(), loaded.getCategory().getId());
        assertEquals(due, loaded.getDueDate());
        assertEquals(TaskStatus.PENDING, loaded.getStatus());
        assertEquals(created.getCreatedAt(), loaded.getCreatedAt());
    }

    @Test
    @DisplayName("Completing and reopening a task is persisted")
    void testTaskStatus() {
        Session session = newSession("status");
        Task task = taskService.create(session, TaskRequest.builder().title("Essay").build());

        taskService.complete(session, task.getId());
        Task completed = taskService.get(session, task.getId());
        assertEquals(TaskStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getCompletedAt());

        taskService.reopen(session, task.getId());
        Task reopened = taskService.get(session, task.getId());
        assertEquals(TaskStatus.PENDING, reopened.getStatus());
        assertNull(reopened.getCompletedAt());
    }

    @Test
    @DisplayName("Users never see each other's data")
    void testIsolation() {
        // Arrange
        Session first = newSession("owner");
        Session second = newSession("other");
        Task task = taskService.create(first, TaskRequest.builder().title("Private task").build());
        StudyLog studyLog = studyLogService.log(first, "Math", 30, null, null);

        // Act & Assert
        assertTrue(taskService.list(second, TaskFilter.all()).isEmpty());
        assertTrue(studyLogService.list(second, null).isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> taskService.get(second, task.getId()));
        assertThrows(ResourceNotFoundException.class, () -> taskService.delete(second, task.getId()));
        assertThrows(ResourceNotFoundException.class, () -> studyLogService.delete(second, studyLog.getId()));
        assertEquals(1, taskService.list(first, TaskFilter.all()).size());
    }

    @Test
    @DisplayName("Quiz results are checked against the number of questions")
    void testQuizResults() {
        Session session = newSession("quiz");

        QuizResult stored = quizService.record(session, "Photosynthesis", 3, 5, List.of());
        assertEquals(3, stored.getScore());
        assertEquals(5, stored.getTotalQuestions());

        assertThrows(ValidationException.class, () -> quizService.record(session, "Photosynthesis", 6, 5, List.of()));
        assertThrows(ValidationException.class, () -> quizService.record(session, "Photosynthesis", 0, 0, List.of()));
        assertThrows(ValidationException.class, () -> quizService.record(session, "Photosynthesis", -1, 5, List.of()));
        assertEquals(1, quizService.list(session, null).size());
    }

    @Test
    @DisplayName("A recorded quiz can be reviewed with its questions and answers")
    void testQuizReview() {
        Session session = newSession("review");
        QuizQuestion question = QuizQuestion.builder()
                .question("Which organelle produces ATP?")
                .choices(List.of("Nucleus", "Mitochondrion", "Ribosome", "Golgi apparatus"))
                .correctIndex(1)
                .explanation("Mitochondria run cellular respiration.")
                .build();
        List<AnsweredQuestion> answers = List.of(
                new AnsweredQuestion(question, 1),
                new AnsweredQuestion(question, 2));
        QuizResult result = quizService.record(session, "Cells", 1, 2, answers);

        QuizReview review = quizService.review(session, result.getId());

        assertEquals("Cells", review.getResult().getTopic());
        assertEquals(2, review.getAnswers().size());
        assertTrue(review.getAnswers().get(0).isCorrect());
        assertFalse(review.getAnswers().get(1).isCorrect());
        assertEquals("Mitochondrion", review.getAnswers().get(0).getQuestion().getChoices().get(1));
    }

    @Test
    @DisplayName("Deleting a category moves its tasks to Uncategorized")
    void testCategoryDelete() {
        Session session = newSession("category");
        Category chemistry = category(session, "Chemistry");
        Task task = taskService.create(session, TaskRequest.builder()
                .title("Balance equations").categoryId(chemistry.getId()).build());

        int reassigned = categoryService.delete(session, chemistry.getId());

        assertEquals(1, reassigned);
        Task loaded = taskService.get(session, task.getId());
        assertNull(loaded.getCategory());
        assertEquals(Category.UNCATEGORIZED, loaded.getCategoryName());
        assertTrue(categoryService.list(session).stream().noneMatch(c -> c.getId().equals(chemistry.getId())));
    }

    @Test
    @DisplayName("Category names are unique per user and Uncategorized is reserved")
    void testCategoryNames() {
        Session session = newSession("names");
        category(session, "Physics");

        assertThrows(ValidationException.class, () -> categoryService.create(session, "Physics"));
        assertThrows(ValidationException.class, () -> categoryService.create(session, Category.UNCATEGORIZED));
    }

    @Test
    @DisplayName("Deleting an account removes all of its data")
    void testAccountDeletionCascade() {
        // Arrange
        Session session = newSession("leaving");
        taskService.create(session, TaskRequest.builder().title("Task").build());
        studyLogService.log(session, "History", 45, "Chapter 2", null);
        quizService.record(session, "Rome", 2, 3, List.of());
        aiContentService.save(session, ContentKind.SUMMARY, null, "Summarize the Roman republic", "It was ...");
        settingsService.setApiKey(session, "test-key");

        // Act
        assertThrows(InvalidCredentialsException.class, () -> authService.deleteAccount(session, "wrong"));
        authService.deleteAccount(session, "password1");

        // Assert
        for (String table : List.of("tasks", "study_logs", "quiz_results", "ai_content",
                "chat_messages", "settings", "categories")) {
            Integer rows = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE owner_user_id = ?", Integer.class, session.getUserId());
            assertEquals(0, rows, "rows left in " + table);
        }
        assertThrows(InvalidCredentialsException.class,
                () -> authService.authenticate(session.getUsername(), "password1"));
    }

    @Test
    @DisplayName("Pomodoro durations fall back to defaults and persist when changed")
    void testPomodoroSettings() {
        Session session = newSession("pomodoro");

        assertEquals(PomodoroDurations.defaults(), settingsService.getPomodoroDurations(session));

        settingsService.setPomodoroDurations(session, new PomodoroDurations(50, 10, 30));
        assertEquals(new PomodoroDurations(50, 10, 30), settingsService.getPomodoroDurations(session));
        assertEquals(Optional.of("50"), settingsService.get(session, Setting.POMODORO_WORK_MINUTES));

        assertThrows(ValidationException.class,
                () -> settingsService.setPomodoroDurations(session, new PomodoroDurations(0, 5, 15)));
        assertThrows(ValidationException.class,
                () -> settingsService.setPomodoroDurations(session, new PomodoroDurations(25, 5, 181)));
    }

    @Test
    @DisplayName("The API key is stored per user and can be cleared")
    void testApiKeySettings() {
        Session session = newSession("apikey");
        assertFalse(settingsService.hasApiKey(session));

        settingsService.setApiKey(session, "  abc123  ");
        assertTrue(settingsService.hasApiKey(session));
        assertEquals("abc123", settingsService.findApiKey(session.getUserId()).orElseThrow());

        settingsService.clearApiKey(session);
        assertFalse(settingsService.hasApiKey(session));
    }

    @Test
    @DisplayName("Saved AI content is listed by kind and can be deleted")
    void testAiContentArchive() {
        Session session = newSession("archive");
        AIContent explanation = aiContentService.save(session, ContentKind.EXPLANATION, null,
                "Explain entropy\nin simple words", "Entropy measures ...");
        aiContentService.save(session, ContentKind.SUMMARY, "Notes", "Summarize", "Short summary");

        assertEquals("Explain entropy", explanation.getTitle());
        assertEquals(1, aiContentService.list(session, ContentKind.EXPLANATION).size());
        assertEquals(2, aiContentService.list(session, null).size());

        aiContentService.delete(session, explanation.getId());
        assertThrows(ResourceNotFoundException.class, () -> aiContentService.get(session, explanation.getId()));
    }

    @Test
    @DisplayName("Analytics reflects logged study time and finished work")
    void testAnalytics() {
        Session session = newSession("analytics");
        Task task = taskService.create(session, TaskRequest.builder().title("Finish lab").build());
        taskService.create(session, TaskRequest.builder().title("Start essay").build());
        taskService.complete(session, task.getId());
        studyLogService.log(session, "Biology", 40, null, null);
        studyLogService.log(session, "Biology", 20, null, null);
        quizService.record(session, "Cells", 4, 5, List.of());

        AnalyticsReport report = analyticsService.report(session);

        assertEquals(2L, report.getTotalTasks());
        assertEquals(0.5, report.getCompletionRate(), 1e-9);
        assertEquals(60L, report.getTotalStudyMinutes());
        assertEquals(1, report.getStudyStreakDays());
        assertEquals("Biology", report.getTopSubjects().get(0).getSubject());
        assertEquals(0.8, report.getAverageQuizScore(), 1e-9);
        assertEquals(10 + 60 + 5, report.getLearningPoints());
    }

    private Category category(Session session, String name) {
        return categoryService.list(session).stream()
                .filter(c -> c.getName().equals(name))
                .findFirst()
                .orElseGet(() -> categoryService.create(session, name));
    }
}
