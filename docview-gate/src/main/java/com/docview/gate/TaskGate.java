package com.docview.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs named asynchronous tasks strictly one at a time, in submission order.
 *
 * <p>The gate owns a single thread. Admission, dispatch, completion handling, the
 * watchdog and {@link #reset()} all run there, so the queue and the in-flight run
 * are only ever touched by that thread. A task is in flight from the moment its
 * {@link AsyncTask#start()} is called until its stage completes, the watchdog fires,
 * or the gate is reset; the next task starts only after that.</p>
 *
 * <p>Each dispatch creates a new run identity. A completion or watchdog event that
 * does not belong to the current run is discarded, so a task that overran its
 * watchdog can never finish a later task's run.</p>
 */
public final class TaskGate implements AutoCloseable {

    public static final long WATCHDOG_TIMEOUT_MS = 30_000;
    public static final int QUEUE_LENGTH_WARNING_THRESHOLD = 10;
    public static final int MAX_QUEUE_SIZE = 100;

    private final ScheduledThreadPoolExecutor loop;
    private final long watchdogTimeoutMs;
    private final List<GateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean isOpen = new AtomicBoolean(true);
    private final AtomicInteger queueLength = new AtomicInteger();

    // Gate thread only
    private final Deque<QueuedTask> queue = new ArrayDeque<>();

    private volatile Run current;

    public TaskGate() {
        this(WATCHDOG_TIMEOUT_MS);
    }

    TaskGate(long watchdogTimeoutMs) {
        if (watchdogTimeoutMs <= 0) {
            throw new IllegalArgumentException("Watchdog timeout must be positive: " + watchdogTimeoutMs);
        }
        this.watchdogTimeoutMs = watchdogTimeoutMs;
        this.loop = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "docview-gate");
            thread.setDaemon(true);
            return thread;
        });
        loop.setRemoveOnCancelPolicy(true);
    }

    public void addListener(GateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Queues {@code task} and returns at once. The task never runs on the caller's thread.
     *
     * @return a future that completes with the task's result, or exceptionally with
     *         {@link TaskRejectedException}, {@link TaskTimeoutException}, the task's own
     *         failure, or a cancellation when the gate is reset
     */
    public CompletableFuture<Object> submit(String taskName, AsyncTask task) {
        QueuedTask queued = new QueuedTask(
            Objects.requireNonNull(taskName, "taskName"),
            Objects.requireNonNull(task, "task"),
            new CompletableFuture<>());
        if (!execute(() -> admit(queued))) {
            queued.result().completeExceptionally(new IllegalStateException("Gate is closed"));
        }
        return queued.result();
    }

    /**
     * Abandons the in-flight task and everything queued behind it. The in-flight stage is
     * cancelled if it supports cancellation, and the futures of all abandoned tasks are
     * cancelled.
     *
     * @return a future that completes once the reset has been applied on the gate thread
     */
    public CompletableFuture<Void> reset() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean scheduled = execute(() -> {
            applyReset();
            done.complete(null);
        });
        if (!scheduled) {
            done.completeExceptionally(new IllegalStateException("Gate is closed"));
        }
        return done;
    }

    /**
     * Number of tasks waiting; the in-flight task is not counted.
     */
    public int queueLength() {
        return queueLength.get();
    }

    public boolean isBusy() {
        return current != null;
    }

    /**
     * Name of the in-flight task, or {@code null} when idle.
     */
    public String currentTaskName() {
        Run run = current;
        return run == null ? null : run.task.name();
    }

    private void admit(QueuedTask task) {
        if (!isOpen.get()) {
            task.result().completeExceptionally(new IllegalStateException("Gate is closed"));
            return;
        }
        if (queue.size() >= MAX_QUEUE_SIZE) {
            LOGGER.warn("Queue full ({} tasks); rejecting {}", queue.size(), task.name());
            notifyListeners(l -> l.taskRejected(task.name()));
            task.result().completeExceptionally(new TaskRejectedException(task.name(), MAX_QUEUE_SIZE));
            return;
        }
        queue.addLast(task);
        int length = publishQueueLength();
        LOGGER.debug("Queued {} ({} waiting)", task.name(), length);
        if (length > QUEUE_LENGTH_WARNING_THRESHOLD) {
            LOGGER.warn("{} tasks waiting in the gate", length);
            notifyListeners(l -> l.queueLengthWarning(length));
        }
        if (current == null) {
            execute(this::dispatch);
        }
    }

    private void dispatch() {
        if (current != null || queue.isEmpty()) {
            return;
        }
        QueuedTask task = queue.pollFirst();
        Run run = new Run(task);
        current = run;
        publishQueueLength();
        LOGGER.debug("Starting {}", task.name());
        notifyListeners(l -> l.taskStarted(task.name()));
        run.watchdog = loop.schedule(() -> onWatchdog(run), watchdogTimeoutMs, MILLISECONDS);

        CompletionStage<Object> stage;
        try {
            stage = Objects.requireNonNull(task.task().start(), "AsyncTask returned no stage");
        } catch (Exception e) {
            stage = CompletableFuture.failedFuture(e);
        }
        run.stage = stage;
        stage.whenComplete((value, error) -> {
            if (!execute(() -> onFinished(run, value, error))) {
                LOGGER.debug("Gate closed before {} finished", task.name());
            }
        });
    }

    private void onFinished(Run run, Object value, Throwable error) {
        if (current != run) {
            LOGGER.debug("Discarding late completion of {}", run.task.name());
            return;
        }
        run.watchdog.cancel(false);
        current = null;
        boolean success = error == null;
        LOGGER.debug("Finished {} (success: {})", run.task.name(), success);
        notifyListeners(l -> l.taskCompleted(run.task.name(), success));
        if (success) {
            run.task.result().complete(value);
        } else {
            run.task.result().completeExceptionally(unwrap(error));
        }
        dispatch();
    }

    private void onWatchdog(Run run) {
        if (current != run) {
            return;
        }
        current = null;
        LOGGER.warn("{} did not finish within {} ms; moving on", run.task.name(), watchdogTimeoutMs);
        notifyListeners(l -> l.taskTimedOut(run.task.name()));
        run.task.result().completeExceptionally(new TaskTimeoutException(run.task.name(), watchdogTimeoutMs));
        dispatch();
    }

    private void applyReset() {
        Run run = current;
        current = null;
        if (run != null) {
            LOGGER.debug("Reset abandons in-flight {}", run.task.name());
            run.watchdog.cancel(false);
            cancel(run.stage);
            run.task.result().cancel(false);
        }
        for (QueuedTask task : queue) {
            task.result().cancel(false);
        }
        queue.clear();
        publishQueueLength();
    }

    private static void cancel(CompletionStage<Object> stage) {
        if (stage == null) {
            return;
        }
        try {
            stage.toCompletableFuture().cancel(true);
        } catch (UnsupportedOperationException e) {
            LOGGER.debug("Stage does not support cancellation", e);
        }
    }

    private int publishQueueLength() {
        int length = queue.size();
        queueLength.set(length);
        notifyListeners(l -> l.queueLengthChanged(length));
        return length;
    }

    private void notifyListeners(Consumer<GateListener> event) {
        for (GateListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.error("Gate listener {} failed", listener, e);
            }
        }
    }

    private boolean execute(Runnable action) {
        try {
            loop.execute(action);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Abandons all work and stops the gate thread once the abandonment has run.
     */
    @Override
    public void close() {
        if (isOpen.getAndSet(false)) {
            LOGGER.debug("Closing");
            execute(this::applyReset);
            loop.shutdown();
        }
    }

    private record QueuedTask(String name, AsyncTask task, CompletableFuture<Object> result) {
    }

    private static final class Run {
        final QueuedTask task;
        ScheduledFuture<?> watchdog;
        CompletionStage<Object> stage;

        Run(QueuedTask task) {
            this.task = task;
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskGate.class);
}
