package com.studyassistant.ui;

import com.studyassistant.exception.GlobalExceptionHandler;
import com.studyassistant.exception.NetworkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AsyncAiCall.
 *
 * Requests run on a real executor; the console reports a pressed Enter
 * only when the test says so.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AsyncAiCall Unit Tests")
class AsyncAiCallTest {

    @Mock
    private GlobalExceptionHandler exceptionHandler;

    private ThreadPoolTaskExecutor executor;
    private KeyboardInput keyboard;
    private ByteArrayOutputStream output;
    private AsyncAiCall asyncAiCall;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setThreadNamePrefix("ai-test-");
        executor.initialize();

        keyboard = new KeyboardInput();
        output = new ByteArrayOutputStream();
        ConsoleIO io = new ConsoleIO(keyboard, new PrintStream(output, true, StandardCharsets.UTF_8));
        asyncAiCall = new AsyncAiCall(executor, io, exceptionHandler);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("await should return the answer computed on the AI executor")
    void testAwait_Success() {
        // Arrange
        AtomicReference<String> worker = new AtomicReference<>();

        // Act
        Optional<String> answer = asyncAiCall.await("Asking Gemini", () -> {
            worker.set(Thread.currentThread().getName());
            sleep(700);
            return "Mitochondria make ATP.";
        });

        // Assert
        assertEquals(Optional.of("Mitochondria make ATP."), answer);
        assertTrue(worker.get().startsWith("ai-test-"));
        assertNotEquals(Thread.currentThread().getName(), worker.get());
        assertTrue(printed().contains("Asking Gemini (press Enter to stop waiting)"));
        assertTrue(printed().contains("."));
    }

    @Test
    @DisplayName("Pressing Enter stops waiting while the request is still running")
    void testAwait_Abandoned() throws InterruptedException {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        keyboard.pressEnter();

        // Act
        Optional<String> answer = asyncAiCall.await("Thinking", () -> {
            await(release);
            finished.countDown();
            return "late answer";
        });

        // Assert
        assertTrue(answer.isEmpty());
        assertEquals(1, finished.getCount());
        assertTrue(printed().contains("Stopped waiting"));

        release.countDown();
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        verifyNoInteractions(exceptionHandler);
    }

    @Test
    @DisplayName("The exception thrown by the request reaches the caller unchanged")
    void testAwait_RequestFails() {
        NetworkException failure = NetworkException.unreachable("Gemini", new SocketTimeoutException("timed out"));

        NetworkException thrown = assertThrows(NetworkException.class,
                () -> asyncAiCall.await("Asking Gemini", () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        verifyNoInteractions(exceptionHandler);
    }

    @Test
    @DisplayName("A failure after the wait was abandoned is still reported")
    void testAwait_AbandonedRequestFails() {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        DataIntegrityViolationException failure =
                new DataIntegrityViolationException("FOREIGN KEY constraint failed");
        keyboard.pressEnter();

        // Act
        Optional<String> answer = asyncAiCall.await("Thinking", () -> {
            await(release);
            throw failure;
        });
        release.countDown();

        // Assert
        assertTrue(answer.isEmpty());
        verify(exceptionHandler, timeout(5000)).handle(failure);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /**
     * Console input holding one empty line that only counts as typed once
     * {@link #pressEnter()} is called.
     */
    private static final class KeyboardInput extends BufferedReader {

        private volatile boolean enterPressed;

        KeyboardInput() {
            super(new StringReader("\n"));
        }

        void pressEnter() {
            enterPressed = true;
        }

        @Override
        public boolean ready() {
            return enterPressed;
        }
    }
}
