package com.studyassistant.ui;

import com.studyassistant.exception.GlobalExceptionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Runs an AI request on the AI executor while the console shows a waiting
 * indicator.
 *
 * Pressing Enter abandons the wait. The request itself is not cancelled: it
 * finishes or times out in the background and its answer is not shown, but
 * what it stores (a chat turn, for one) is still stored. A failure of an
 * abandoned request goes through {@link GlobalExceptionHandler} so it is
 * still logged.
 */
@Component
@Slf4j
public class AsyncAiCall {

    private static final long POLL_MILLIS = 500;

    private final AsyncTaskExecutor aiExecutor;
    private final ConsoleIO io;
    private final GlobalExceptionHandler exceptionHandler;

    public AsyncAiCall(@Qualifier("aiExecutor") AsyncTaskExecutor aiExecutor, ConsoleIO io,
                       GlobalExceptionHandler exceptionHandler) {
        this.aiExecutor = aiExecutor;
        this.io = io;
        this.exceptionHandler = exceptionHandler;
    }

    /**
     * Run the request and wait for it.
     *
     * @param label text shown while waiting
     * @param request the call to make
     * @return the result, or empty if the user stopped waiting
     * @throws RuntimeException the exception thrown by the request itself
     */
    public <T> Optional<T> await(String label, Supplier<T> request) {
        Callable<T> task = request::get;
        CompletableFuture<T> future = aiExecutor.submitCompletable(task);
        io.print(label + " (press Enter to stop waiting) ");

        try {
            while (!future.isDone()) {
                if (io.inputAvailable()) {
                    io.takePendingLine();
                    io.println();
                    io.println("Stopped waiting. The request will finish in the background; its answer will not be shown.");
                    log.info("User abandoned AI request: {}", label);
                    reportFailureOf(label, future);
                    return Optional.empty();
                }
                Thread.sleep(POLL_MILLIS);
                io.print(".");
            }
            io.println();
            return Optional.ofNullable(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        } catch (ExecutionException e) {
            io.println();
            throw unwrap(e);
        }
    }

    private void reportFailureOf(String label, CompletableFuture<?> abandoned) {
        abandoned.whenComplete((result, failure) -> {
            if (failure != null) {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause()
                        : failure;
                log.info("Abandoned AI request '{}' failed", label);
                exceptionHandler.handle(cause);
            }
        });
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("AI request failed", cause);
    }
}
