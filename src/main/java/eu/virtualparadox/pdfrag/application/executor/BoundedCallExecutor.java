package eu.virtualparadox.pdfrag.application.executor;

import eu.virtualparadox.pdfrag.exception.BackendCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking backend calls (embedding provider, vector store) on a dedicated pool and waits
 * for them at most a caller-supplied duration.
 * <p>
 * A call that exceeds its timeout is reported as a {@link BackendCallException} but is
 * <em>not</em> cancelled: an issued backend call runs to completion or failure in the
 * background. {@link IllegalArgumentException}s raised by the task are rethrown unchanged so
 * input errors keep their type.
 * </p>
 */
@Slf4j
public class BoundedCallExecutor extends ThreadPoolTaskExecutor {

    /**
     * Creates and initializes an executor.
     *
     * @param threadNamePrefix prefix of worker thread names
     * @param maxThreads       maximum concurrent backend calls
     * @return an initialized executor
     */
    public static BoundedCallExecutor create(final String threadNamePrefix, final int maxThreads) {
        final BoundedCallExecutor executor = new BoundedCallExecutor();
        executor.setCorePoolSize(maxThreads);
        executor.setMaxPoolSize(maxThreads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Executes {@code task} and waits at most {@code timeout} for its result.
     *
     * @param description human readable description used in error messages
     * @param task        blocking backend call
     * @param timeout     maximum wait
     * @param <T>         result type
     * @return the task result
     * @throws BackendCallException on timeout, interruption or task failure
     */
    public <T> T call(final String description,
                      final Callable<T> task,
                      final Duration timeout) throws BackendCallException {
        final Future<T> future = submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} timed out after {} ms", description, timeout.toMillis());
            throw new BackendCallException(description + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendCallException(description + " was interrupted", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw new BackendCallException(description + " failed: " + cause.getMessage(), cause);
        }
    }
}
