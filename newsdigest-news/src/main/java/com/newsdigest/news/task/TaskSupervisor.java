package com.newsdigest.news.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs named background tasks with a cancellation handle and an observable outcome.
 * At most one task per name runs at a time; submitting a name that is running returns the running task.
 */
public class TaskSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    private final ExecutorService executor;
    private final Map<String, TrackedTask<?>> tasks = new ConcurrentHashMap<>();

    public TaskSupervisor() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "digest-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a task, or return the one already running under this name.
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> TrackedTask<T> submit(String name, CancellableTask<T> work) {
        TrackedTask<?> existing = tasks.get(name);
        if (existing != null && !existing.getState().isDone()) {
            log.info("Task {} already running since {}", name, existing.getStartedAt());
            return (TrackedTask<T>) existing;
        }

        CancellationToken token = new CancellationToken();
        TrackedTask<T> task = new TrackedTask<>(name, token);
        tasks.put(name, task);

        try {
            executor.execute(() -> runTask(task, work, token));
        } catch (RejectedExecutionException e) {
            task.fail(e);
            throw e;
        }
        log.info("Started task {}", name);
        return task;
    }

    private <T> void runTask(TrackedTask<T> task, CancellableTask<T> work, CancellationToken token) {
        try {
            T result = work.run(token);
            task.complete(result);
            log.info("Task {} completed", task.getName());
        } catch (CancelledException e) {
            task.fail(e);
            log.info("Task {} cancelled: {}", task.getName(), e.getMessage());
        } catch (Exception e) {
            task.fail(e);
            log.error("Task {} failed: {}", task.getName(), e.getMessage(), e);
        } catch (Error e) {
            // The task leaves RUNNING even when its thread dies
            task.fail(e);
            log.error("Task {} aborted by {}", task.getName(), e.toString(), e);
            throw e;
        }
    }

    public Optional<TrackedTask<?>> find(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public boolean isRunning(String name) {
        TrackedTask<?> task = tasks.get(name);
        return task != null && !task.getState().isDone();
    }

    /**
     * Request cancellation of the running task with this name.
     *
     * @return false if no such task is running
     */
    public boolean cancel(String name) {
        TrackedTask<?> task = tasks.get(name);
        if (task == null || task.getState().isDone()) {
            return false;
        }
        task.cancel();
        log.info("Cancellation requested for task {}", name);
        return true;
    }

    public List<TrackedTask<?>> list() {
        return new ArrayList<>(tasks.values());
    }

    @Override
    public void close() {
        tasks.values().forEach(TrackedTask::cancel);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
