package de.mirkosertic.filevault.task;

import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.indexsync.CancellationToken;
import de.mirkosertic.filevault.indexsync.IndexSyncException;
import de.mirkosertic.filevault.indexsync.IndexSyncService;
import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.SyncMode;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs index reconciliation as a task: synchronously for the command line and the admin
 * endpoint, asynchronously for MCP clients, and optionally on a fixed schedule.
 * <p>
 * Every accepted request gets a task id. Structural errors (invalid mode, missing force)
 * are thrown before a task is created. The most recent tasks are kept for status queries.
 */
public class IndexRebuildTask {

    private static final Logger logger = LoggerFactory.getLogger(IndexRebuildTask.class);

    private static final int MAX_REMEMBERED_TASKS = 50;

    private final IndexSyncService syncService;
    private final ExecutorService asyncRunner;
    private ScheduledExecutorService scheduler;

    private final Map<String, TaskResult> tasks = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(final Map.Entry<String, TaskResult> eldest) {
            return size() > MAX_REMEMBERED_TASKS && eldest.getValue().status().isFinished();
        }
    };
    private final Map<String, CancellationToken> runningTokens = new LinkedHashMap<>();
    private String lastTaskId;

    public IndexRebuildTask(final IndexSyncService syncService) {
        this.syncService = syncService;
        this.asyncRunner = Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "index-rebuild");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run a request on the calling thread and return the finished task.
     *
     * @throws IndexSyncException for structural errors; no task is created
     */
    public TaskResult run(final SyncRequest request) throws IndexSyncException {
        request.checkForce();
        final String taskId = register(request);
        return execute(taskId, request);
    }

    /**
     * Accept a request and run it in the background.
     *
     * @return the running task
     * @throws IndexSyncException for structural errors; no task is created
     */
    public TaskResult submit(final SyncRequest request) throws IndexSyncException {
        request.checkForce();
        final String taskId = register(request);
        asyncRunner.execute(() -> execute(taskId, request));
        return getTask(taskId).orElseThrow();
    }

    public Optional<TaskResult> getTask(final String taskId) {
        synchronized (tasks) {
            return Optional.ofNullable(tasks.get(taskId));
        }
    }

    public Optional<TaskResult> getLastTask() {
        synchronized (tasks) {
            return lastTaskId == null ? Optional.empty() : Optional.ofNullable(tasks.get(lastTaskId));
        }
    }

    /**
     * Status of the most recent task, {@link TaskStatus#IDLE} if there never was one.
     */
    public TaskStatus getStatus() {
        return getLastTask().map(TaskResult::status).orElse(TaskStatus.IDLE);
    }

    /**
     * Request cancellation of a running task. The task stops between items and finishes
     * as {@link TaskStatus#CANCELLED} with its partial stats.
     *
     * @return false if no such task is running
     */
    public boolean cancel(final String taskId) {
        final CancellationToken token;
        synchronized (tasks) {
            token = runningTokens.get(taskId);
        }
        if (token == null) {
            return false;
        }
        logger.info("Cancelling index rebuild task {}", taskId);
        token.cancel();
        return true;
    }

    /**
     * Cancel every running task.
     *
     * @return number of tasks asked to stop
     */
    public int cancelAll() {
        final List<String> running;
        synchronized (tasks) {
            running = new ArrayList<>(runningTokens.keySet());
        }
        int cancelled = 0;
        for (final String taskId : running) {
            if (cancel(taskId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Start the periodic run configured under {@code index-sync.schedule}. Does nothing when
     * the interval is 0. A destructive scheduled mode without {@code force: true} is refused.
     */
    public void startSchedule(final ApplicationConfig config) {
        final long intervalMinutes = config.getScheduleIntervalMinutes();
        if (intervalMinutes <= 0) {
            logger.debug("No scheduled index rebuild configured");
            return;
        }

        final SyncRequest request;
        try {
            request = new SyncRequest(SyncMode.parse(config.getScheduleMode()), null, false, false,
                    config.isScheduleForce());
            request.checkForce();
        } catch (final IndexSyncException e) {
            logger.warn("Scheduled index rebuild disabled: {}", e.getMessage());
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "index-rebuild-schedule");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(() -> runScheduled(request), intervalMinutes, intervalMinutes,
                TimeUnit.MINUTES);
        logger.info("Scheduled index rebuild every {} minutes in mode {}", intervalMinutes, request.mode());
    }

    private void runScheduled(final SyncRequest request) {
        try {
            run(request);
        } catch (final IndexSyncException e) {
            logger.warn("Scheduled index rebuild rejected: {}", e.getMessage());
        } catch (final RuntimeException e) {
            // Keep the schedule alive
            logger.error("Scheduled index rebuild failed", e);
        }
    }

    public void shutdown() {
        cancelAll();
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        asyncRunner.shutdown();
        try {
            if (!asyncRunner.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Index rebuild task did not terminate in time, forcing shutdown");
                asyncRunner.shutdownNow();
            }
        } catch (final InterruptedException e) {
            asyncRunner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private String register(final SyncRequest request) {
        final String taskId = UUID.randomUUID().toString();
        synchronized (tasks) {
            tasks.put(taskId, TaskResult.running(taskId, request));
            runningTokens.put(taskId, new CancellationToken());
            lastTaskId = taskId;
        }
        logger.info("Index rebuild task {} accepted: mode={}, scope={}, dryRun={}",
                taskId, request.mode(), request.describeScope(), request.dryRun());
        return taskId;
    }

    private TaskResult execute(final String taskId, final SyncRequest request) {
        final CancellationToken token;
        synchronized (tasks) {
            token = runningTokens.get(taskId);
        }

        TaskResult result;
        try {
            final IndexSyncStats stats = syncService.sync(request, token);
            final TaskStatus status = stats.cancelled() ? TaskStatus.CANCELLED : TaskStatus.SUCCESSFUL;
            result = current(taskId).finished(status, stats, List.of());
        } catch (final IndexSyncException | RuntimeException e) {
            logger.error("Index rebuild task {} failed", taskId, e);
            result = current(taskId).finished(TaskStatus.FAILED, null, List.of(e.toString()));
        }

        synchronized (tasks) {
            tasks.put(taskId, result);
            runningTokens.remove(taskId);
        }
        logger.info("Index rebuild task {} finished with status {}", taskId, result.status());
        return result;
    }

    private TaskResult current(final String taskId) {
        synchronized (tasks) {
            return tasks.get(taskId);
        }
    }
}
