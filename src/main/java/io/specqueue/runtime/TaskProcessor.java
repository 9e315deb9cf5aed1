package io.specqueue.runtime;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.specqueue.config.QueueConfig;
import io.specqueue.config.QueueSettings;
import io.specqueue.config.SourceDefinition;
import io.specqueue.config.SourceLayout;
import io.specqueue.config.SpecQueuePaths;
import io.specqueue.coordinator.SourceCoordinator;
import io.specqueue.executor.ExecutionRequest;
import io.specqueue.executor.ExecutionResult;
import io.specqueue.executor.TaskExecutor;
import io.specqueue.model.ProcessingMarker;
import io.specqueue.model.QueueState;
import io.specqueue.model.QueueStatistics;
import io.specqueue.model.QueueStatus;
import io.specqueue.model.SourceState;
import io.specqueue.model.SourceStatus;
import io.specqueue.model.TaskOrigin;
import io.specqueue.model.TaskRecord;
import io.specqueue.model.TaskStatus;
import io.specqueue.model.TaskView;
import io.specqueue.observability.AuditLogger;
import io.specqueue.scan.DirectoryScanner;
import io.specqueue.scan.DiscoveredTask;
import io.specqueue.storage.AtomicStateStore;
import io.specqueue.storage.InterprocessLock;
import io.specqueue.storage.LockTimeoutException;
import io.specqueue.storage.ProcessIdentity;
import io.specqueue.storage.ProcessLiveness;
import io.specqueue.storage.QueueStateException;
import io.specqueue.storage.RunningMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the persisted queue state: merges scanned files into per-source queues, dispatches
 * pending tasks round-robin across sources and records their outcome.
 *
 * <p>Every mutation is a read-modify-persist cycle of the state file under the state lock.
 * The lock is held while claiming and while committing a task, never while the executor
 * runs, so workers of different sources execute in parallel. A source never runs more than
 * one task at a time: a claimed task stays {@link TaskStatus#RUNNING} with the owner's pid in
 * the source's processing marker until its outcome is committed.
 */
public final class TaskProcessor {
    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);
    private static final int COMMIT_ATTEMPTS = 3;
    private static final String CANCELLED_REASON = "Cancelled: execution interrupted by shutdown";

    private final QueueSettings settings;
    private final Map<String, SourceDefinition> sources;
    private final List<String> orderedSourceIds;
    private final Path workingDirectory;
    private final SpecQueuePaths paths;
    private final TaskExecutor executor;
    private final AuditLogger audit;
    private final ProcessLiveness liveness;
    private final ProcessIdentity self;
    private final Clock clock;
    private final AtomicStateStore store;
    private final DirectoryScanner scanner;
    private final StateMigrator migrator;
    private final TaskArchiver archiver;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean stopping;

    public TaskProcessor(QueueConfig config, SpecQueuePaths paths, TaskExecutor executor) {
        this(
                config,
                paths,
                executor,
                new AuditLogger(paths.auditFile()),
                ProcessLiveness.system(),
                ProcessIdentity.current(),
                Clock.systemUTC()
        );
    }

    public TaskProcessor(
            QueueConfig config,
            SpecQueuePaths paths,
            TaskExecutor executor,
            AuditLogger audit,
            ProcessLiveness liveness,
            ProcessIdentity self,
            Clock clock
    ) {
        this.settings = config.settings();
        Map<String, SourceDefinition> configured = new LinkedHashMap<>();
        for (SourceDefinition source : config.sources()) {
            configured.put(source.id(), source);
        }
        this.sources = Collections.unmodifiableMap(configured);
        this.workingDirectory = config.projectWorkspace() == null || config.projectWorkspace().isBlank()
                ? null
                : Paths.get(config.projectWorkspace());
        this.paths = paths;
        this.executor = executor;
        this.audit = audit;
        this.liveness = liveness;
        this.self = self;
        this.clock = clock;
        this.store = new AtomicStateStore();
        this.scanner = new DirectoryScanner(settings.enableFingerprint(), settings.watchPatterns());
        this.migrator = new StateMigrator();
        this.archiver = new TaskArchiver(store);
        this.orderedSourceIds = List.copyOf(configured.keySet());
    }

    public DirectoryScanner scanner() {
        return scanner;
    }

    public QueueSettings settings() {
        return settings;
    }

    public List<String> sourceIds() {
        return orderedSourceIds;
    }

    public Optional<SourceLayout> layout(String sourceId) {
        SourceDefinition source = sources.get(sourceId);
        return source == null ? Optional.empty() : Optional.of(source.layout());
    }

    public void requestStop() {
        stopping = true;
    }

    public boolean stopRequested() {
        return stopping;
    }

    public LoadOutcome loadTasks(TaskOrigin origin) {
        return loadTasks(orderedSourceIds, origin);
    }

    public LoadOutcome loadTasks(Collection<String> sourceIds, TaskOrigin origin) {
        List<DiscoveredTask> discovered = new ArrayList<>();
        for (String sourceId : sourceIds) {
            SourceDefinition source = requireSource(sourceId);
            discovered.addAll(scanner.scan(sourceId, source.layout().pending()));
        }
        LoadOutcome outcome = mutate(settings.lockTimeout(), (state, now) -> merge(state, discovered, origin, now));
        if (outcome.added() > 0 || outcome.requeued() > 0) {
            log.info("Loaded {} new and {} changed task(s) from {}", outcome.added(), outcome.requeued(), outcome.bySource().keySet());
        }
        return outcome;
    }

    public boolean loadSingleTask(Path file, String sourceId, TaskOrigin origin) {
        requireSource(sourceId);
        Optional<DiscoveredTask> discovered = scanner.describe(sourceId, file.toAbsolutePath().normalize());
        if (discovered.isEmpty()) {
            return false;
        }
        LoadOutcome outcome = mutate(settings.lockTimeout(), (state, now) -> merge(state, List.of(discovered.get()), origin, now));
        boolean loaded = outcome.added() + outcome.requeued() > 0;
        if (loaded) {
            log.info("[{}] [{}] loaded from {} ({})", sourceId, discovered.get().taskId(), file, origin.wireName());
        }
        return loaded;
    }

    private LoadOutcome merge(QueueState state, List<DiscoveredTask> discovered, TaskOrigin origin, Instant now) {
        int added = 0;
        int requeued = 0;
        int unchanged = 0;
        Map<String, Integer> bySource = new LinkedHashMap<>();
        for (DiscoveredTask task : discovered) {
            SourceState source = state.sources().get(task.sourceId());
            if (source == null) {
                continue;
            }
            Optional<TaskRecord> known = source.find(task.taskId());
            if (known.isEmpty()) {
                source.queue().add(new TaskRecord(
                        task.taskId(),
                        task.specFile().toString(),
                        task.sourceId(),
                        origin,
                        task.fingerprint(),
                        task.fileSize(),
                        now
                ));
                source.statistics().recordQueued(1);
                state.globalStatistics().recordQueued(1);
                audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_ENQUEUE, task.sourceId(), task.taskId(), "pending",
                        Map.of("origin", origin.wireName(), "specPath", task.specFile().toString())));
                added++;
            } else {
                TaskRecord record = known.get();
                if (record.isRunning() || !scanner.isModified(task, record.contentFingerprint())) {
                    unchanged++;
                    continue;
                }
                record.updateFile(task.specFile().toString(), task.fingerprint(), task.fileSize());
                if (record.status() != TaskStatus.COMPLETED) {
                    unchanged++;
                    continue;
                }
                record.requeue(origin);
                audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_REQUEUE, task.sourceId(), task.taskId(), "pending",
                        Map.of("origin", origin.wireName())));
                log.info("[{}] [{}] specification changed, requeued", task.sourceId(), task.taskId());
                requeued++;
            }
            source.touch(now);
            source.statistics().recordLoad(now);
            bySource.merge(task.sourceId(), 1, Integer::sum);
        }
        if (added + requeued > 0) {
            state.globalStatistics().recordLoad(now);
        }
        return new LoadOutcome(added, requeued, unchanged, bySource);
    }

    /**
     * Dispatches pending tasks until nothing in scope is eligible, the task limit is reached
     * or a stop was requested.
     *
     * <p>Returns {@link ProcessStatus#SKIPPED} when the state lock stays busy for the
     * process lock timeout; that is contention, not an error.
     */
    public ProcessOutcome processTasks(ProcessRequest request) {
        Set<String> scope = request.scope();
        Optional<Integer> pendingInScope = tryMutate(settings.processLockTimeout(), (state, now) -> {
            reclaimStale(state, now);
            return pendingCount(state, scope);
        });
        if (pendingInScope.isEmpty()) {
            log.debug("State lock busy, skipping processing cycle for {}", scope.isEmpty() ? "all sources" : scope);
            return ProcessOutcome.skipped();
        }
        if (pendingInScope.get() == 0) {
            return ProcessOutcome.empty();
        }

        List<DispatchedTask> dispatched = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int processed = 0;
        int failed = 0;
        int cancelled = 0;
        while (!stopping && (request.maxTasks() <= 0 || dispatched.size() < request.maxTasks())) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            Optional<Claim> claim;
            try {
                claim = claimNext(scope);
            } catch (LockTimeoutException e) {
                String warning = "State lock busy while claiming: " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
                break;
            }
            if (claim.isEmpty()) {
                break;
            }
            DispatchedTask outcome = run(claim.get(), warnings);
            dispatched.add(outcome);
            if (outcome.status() == TaskStatus.COMPLETED) {
                processed++;
            } else if (outcome.status() == TaskStatus.FAILED) {
                failed++;
            } else {
                cancelled++;
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        int remaining = pendingCount(loadState(false), scope);
        return new ProcessOutcome(ProcessStatus.COMPLETED, processed, failed, cancelled, remaining, dispatched, warnings);
    }

    private Optional<Claim> claimNext(Set<String> scope) {
        AtomicReference<Claim> taken = new AtomicReference<>();
        try {
            return mutate(settings.lockTimeout(), (state, now) -> {
                Optional<Claim> claim = claimNext(state, scope, now);
                claim.ifPresent(taken::set);
                return claim;
            });
        } catch (RuntimeException e) {
            Claim orphan = taken.get();
            if (orphan != null) {
                // Claimed but never persisted: give the task back.
                inFlight.remove(orphan.key());
                releaseQuietly(orphan);
            }
            throw e;
        }
    }

    private Optional<Claim> claimNext(QueueState state, Set<String> scope, Instant now) {
        reclaimStale(state, now);
        Set<String> eligible = new LinkedHashSet<>();
        for (SourceState source : state.sources().values()) {
            if (!inScope(scope, source.id()) || !sources.containsKey(source.id())) {
                continue;
            }
            if (source.running().isPresent()) {
                continue;
            }
            Optional<TaskRecord> next = source.nextPending();
            if (next.isEmpty()) {
                continue;
            }
            RunningMarker marker = marker(source.id(), next.get().id());
            RunningMarker.State markerState = marker.inspect();
            if (markerState == RunningMarker.State.HELD) {
                log.debug("[{}] [{}] running marker held by another process", source.id(), next.get().id());
                continue;
            }
            if (markerState == RunningMarker.State.RECLAIMED) {
                log.info("[{}] [{}] removed abandoned running marker", source.id(), next.get().id());
                audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_RECLAIM, source.id(), next.get().id(), "marker_removed"));
            }
            eligible.add(source.id());
        }

        SourceCoordinator coordinator = new SourceCoordinator(state.coordinator(), clock);
        while (true) {
            Optional<String> picked = coordinator.dispatch(eligible);
            if (picked.isEmpty()) {
                return Optional.empty();
            }
            String sourceId = picked.get();
            SourceState source = state.sources().get(sourceId);
            TaskRecord record = source.nextPending().orElseThrow();
            RunningMarker marker = marker(sourceId, record.id());
            if (!marker.claim(sourceId, Duration.ZERO)) {
                eligible.remove(sourceId);
                continue;
            }
            record.markRunning(now);
            source.processing(ProcessingMarker.running(record.id(), self.pid(), self.hostname(), now));
            source.touch(now);
            Claim claim = new Claim(
                    sourceId,
                    record.id(),
                    Paths.get(record.specPath()),
                    record.attempts(),
                    now,
                    sources.get(sourceId).layout(),
                    marker
            );
            inFlight.add(claim.key());
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_DISPATCH, sourceId, record.id(), "running",
                    Map.of("attempt", record.attempts(), "pid", self.pid())));
            log.info("[{}] [{}] dispatching (attempt {})", sourceId, record.id(), record.attempts());
            return Optional.of(claim);
        }
    }

    private DispatchedTask run(Claim claim, List<String> warnings) {
        ExecutionResult result;
        boolean cancelled = false;
        try {
            String payload = Files.readString(claim.specPath());
            result = executor.execute(new ExecutionRequest(
                    claim.taskId(),
                    claim.sourceId(),
                    claim.specPath(),
                    payload,
                    workingDirectory,
                    claim.attempt()
            ));
            if (result == null) {
                result = ExecutionResult.fail("Executor returned no result");
            }
        } catch (InterruptedException e) {
            cancelled = true;
            result = ExecutionResult.fail(CANCELLED_REASON);
        } catch (Exception e) {
            result = ExecutionResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        Instant finishedAt = Instant.now(clock);

        TaskStatus status;
        try {
            status = commit(claim, result, cancelled, warnings);
        } finally {
            inFlight.remove(claim.key());
            releaseQuietly(claim);
        }
        double durationSeconds = Duration.between(claim.startedAt(), finishedAt).toMillis() / 1000.0;
        if (cancelled) {
            log.warn("[{}] [{}] execution cancelled, returned to pending", claim.sourceId(), claim.taskId());
            Thread.currentThread().interrupt();
            return new DispatchedTask(claim.sourceId(), claim.taskId(), status, CANCELLED_REASON, durationSeconds);
        }
        if (status == TaskStatus.COMPLETED) {
            log.info("[{}] [{}] completed in {}s", claim.sourceId(), claim.taskId(), durationSeconds);
        } else {
            log.info("[{}] [{}] failed: {}", claim.sourceId(), claim.taskId(), result.error());
        }

        boolean success = status == TaskStatus.COMPLETED;
        TaskArchiver.ArchiveReport report = archiver.archive(
                claim.layout(),
                claim.taskId(),
                claim.specPath(),
                success,
                result.error(),
                claim.attempt(),
                finishedAt
        );
        warnings.addAll(report.warnings());
        warnings.addAll(archiver.writeResult(claim.layout(), new TaskResultDocument(
                claim.taskId(),
                claim.sourceId(),
                claim.specPath().toString(),
                success,
                status,
                claim.attempt(),
                claim.startedAt(),
                finishedAt,
                durationSeconds,
                result.output(),
                result.error(),
                result.usage(),
                result.costUsd(),
                report.archivedPath() == null ? null : report.archivedPath().toString()
        )));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", claim.attempt());
        details.put("durationSeconds", durationSeconds);
        if (result.error() != null) {
            details.put("error", result.error());
        }
        audit.log(AuditLogger.AuditEvent.of(
                success ? AuditLogger.TASK_COMPLETE : AuditLogger.TASK_FAIL,
                claim.sourceId(),
                claim.taskId(),
                status.wireName(),
                details
        ));
        return new DispatchedTask(claim.sourceId(), claim.taskId(), status, result.error(), durationSeconds);
    }

    /**
     * Writes the outcome back. Retried on lock contention; if it never lands the task stays
     * RUNNING under this pid and is reclaimed on the next cycle once it leaves the in-flight set.
     */
    private TaskStatus commit(Claim claim, ExecutionResult result, boolean cancelled, List<String> warnings) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= COMMIT_ATTEMPTS; attempt++) {
            try {
                return mutate(settings.lockTimeout(), (state, now) -> {
                    SourceState source = state.sources().get(claim.sourceId());
                    Optional<TaskRecord> found = source == null ? Optional.empty() : source.find(claim.taskId());
                    if (found.isEmpty()) {
                        String warning = "Task " + claim.taskId() + " was unloaded while running; outcome not recorded";
                        log.warn("[{}] {}", claim.sourceId(), warning);
                        warnings.add(warning);
                        return cancelled ? TaskStatus.PENDING : result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
                    }
                    TaskRecord record = found.get();
                    if (cancelled) {
                        record.release(CANCELLED_REASON);
                    } else if (result.success()) {
                        record.markCompleted(now);
                        source.statistics().recordCompleted(now);
                        state.globalStatistics().recordCompleted(now);
                    } else {
                        String error = result.error() == null || result.error().isBlank() ? "Task failed" : result.error();
                        record.markFailed(now, error);
                        source.statistics().recordFailed(now);
                        state.globalStatistics().recordFailed(now);
                    }
                    if (claim.taskId().equals(source.processing().taskId())) {
                        source.processing(ProcessingMarker.idle());
                    }
                    source.touch(now);
                    return record.status();
                });
            } catch (LockTimeoutException | QueueStateException e) {
                last = e;
                log.warn("[{}] [{}] commit attempt {} of {} failed: {}",
                        claim.sourceId(), claim.taskId(), attempt, COMMIT_ATTEMPTS, e.getMessage());
            }
        }
        throw last;
    }

    /**
     * Returns RUNNING records whose owner is gone to the queue. Owners on another host are
     * assumed alive. A record owned by this pid but not executing here is abandoned.
     */
    private void reclaimStale(QueueState state, Instant now) {
        for (SourceState source : state.sources().values()) {
            ProcessingMarker processing = source.processing();
            for (TaskRecord record : source.queue()) {
                if (!record.isRunning()) {
                    continue;
                }
                boolean ownerKnown = processing.active()
                        && record.id().equals(processing.taskId())
                        && processing.pid() != null;
                boolean ownPid = ownerKnown && processing.pid() == self.pid();
                String reason;
                if (!ownerKnown) {
                    reason = "no owner recorded";
                } else if (!self.sameHost(processing.hostname())) {
                    continue;
                } else if (ownPid) {
                    if (inFlight.contains(key(source.id(), record.id()))) {
                        continue;
                    }
                    reason = "abandoned by this process (pid " + processing.pid() + ")";
                } else if (liveness.isAlive(processing.pid())) {
                    continue;
                } else {
                    reason = "owner pid " + processing.pid() + " is gone";
                }

                if (sources.containsKey(source.id())) {
                    RunningMarker marker = marker(source.id(), record.id());
                    if (ownPid) {
                        marker.discard();
                    } else if (marker.inspect() == RunningMarker.State.HELD) {
                        continue;
                    }
                }
                if (record.attempts() >= settings.maxAttempts()) {
                    record.markFailed(now, "Abandoned after " + record.attempts() + " attempt(s): " + reason);
                    source.statistics().recordFailed(now);
                    state.globalStatistics().recordFailed(now);
                } else {
                    record.release("Reclaimed: " + reason);
                }
                if (record.id().equals(processing.taskId())) {
                    source.processing(ProcessingMarker.idle());
                }
                source.touch(now);
                log.info("[{}] [{}] reclaimed stale running task ({}), now {}",
                        source.id(), record.id(), reason, record.status().wireName());
                audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_RECLAIM, source.id(), record.id(), record.status().wireName(),
                        Map.of("reason", reason, "attempts", record.attempts())));
            }
            ProcessingMarker current = source.processing();
            if (current.active()) {
                boolean stillRunning = current.taskId() != null
                        && source.find(current.taskId()).map(TaskRecord::isRunning).orElse(false);
                if (!stillRunning) {
                    source.processing(ProcessingMarker.idle());
                }
            }
        }
    }

    public int unloadSource(String sourceId) {
        int removed = mutate(settings.lockTimeout(), (state, now) -> {
            SourceState source = state.sources().remove(sourceId);
            if (source == null) {
                return -1;
            }
            new SourceCoordinator(state.coordinator(), clock).removeSource(sourceId);
            int count = source.queue().size();
            state.globalStatistics().recordUnloaded(count);
            if (source.running().isPresent()) {
                log.warn("[{}] unloaded while task {} is running", sourceId, source.running().get().id());
            }
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.SOURCE_UNLOAD, sourceId, null, "removed", Map.of("tasks", count)));
            return count;
        }, false);
        if (removed < 0) {
            return 0;
        }
        log.info("[{}] unloaded {} task(s)", sourceId, removed);
        return removed;
    }

    public QueueStatus status() {
        QueueState state = loadState(false);
        List<SourceStatus> views = new ArrayList<>();
        for (SourceState source : state.sources().values()) {
            views.add(SourceStatus.of(source, sources.containsKey(source.id())));
        }
        for (String sourceId : orderedSourceIds) {
            if (!state.sources().containsKey(sourceId)) {
                views.add(SourceStatus.of(new SourceState(sourceId, sources.get(sourceId).layout().root().toString()), true));
            }
        }
        QueueStatistics global = state.globalStatistics();
        int total = 0;
        for (SourceState source : state.sources().values()) {
            total += source.queue().size();
        }
        return new QueueStatus(
                state.version(),
                paths.stateFile().toString(),
                state.coordinator().currentSource(),
                state.coordinator().lastSwitch(),
                List.copyOf(state.coordinator().sourceOrder()),
                total,
                state.count(TaskStatus.PENDING),
                state.count(TaskStatus.RUNNING),
                state.count(TaskStatus.COMPLETED),
                state.count(TaskStatus.FAILED),
                global.totalQueued(),
                global.totalCompleted(),
                global.totalFailed(),
                global.lastProcessedAt(),
                global.lastLoadAt(),
                state.updatedAt(),
                List.copyOf(views)
        );
    }

    public Optional<SourceStatus> sourceStatus(String sourceId) {
        for (SourceStatus source : status().sources()) {
            if (source.sourceId().equals(sourceId)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    public List<TaskView> tasks(String sourceId, TaskStatus status) {
        QueueState state = loadState(false);
        List<TaskView> views = new ArrayList<>();
        for (SourceState source : state.sources().values()) {
            if (sourceId != null && !sourceId.equals(source.id())) {
                continue;
            }
            for (TaskRecord record : source.queue()) {
                if (status == null || record.status() == status) {
                    views.add(TaskView.of(record));
                }
            }
        }
        return views;
    }

    @FunctionalInterface
    private interface Mutation<T> {
        T apply(QueueState state, Instant now);
    }

    private <T> T mutate(Duration timeout, Mutation<T> mutation) {
        return mutate(timeout, mutation, true);
    }

    private <T> T mutate(Duration timeout, Mutation<T> mutation, boolean syncSources) {
        try (InterprocessLock lock = new InterprocessLock(paths.stateLockFile(), settings.lockPollInterval())) {
            lock.acquireOrThrow(timeout);
            return applyLocked(mutation, syncSources);
        }
    }

    private <T> Optional<T> tryMutate(Duration timeout, Mutation<T> mutation) {
        try (InterprocessLock lock = new InterprocessLock(paths.stateLockFile(), settings.lockPollInterval())) {
            if (!lock.acquire(timeout)) {
                return Optional.empty();
            }
            return Optional.of(applyLocked(mutation, true));
        }
    }

    private <T> T applyLocked(Mutation<T> mutation, boolean syncSources) {
        QueueState state = loadState(true);
        Instant now = Instant.now(clock);
        if (syncSources) {
            syncSources(state);
        }
        T result = mutation.apply(state, now);
        persist(state, now);
        return result;
    }

    private void syncSources(QueueState state) {
        for (SourceDefinition definition : sources.values()) {
            String root = definition.layout().root().toString();
            SourceState source = state.sources().get(definition.id());
            if (source == null) {
                state.sources().put(definition.id(), new SourceState(definition.id(), root));
            } else if (!root.equals(source.path())) {
                source.path(root);
            }
        }
        new SourceCoordinator(state.coordinator(), clock).syncSources(state.sources().keySet());
    }

    private QueueState loadState(boolean preserveCorrupt) {
        Path stateFile = paths.stateFile();
        if (!Files.exists(stateFile)) {
            return QueueState.empty();
        }
        Optional<JsonNode> tree = store.readTree(stateFile);
        if (tree.isEmpty()) {
            return recoverCorrupt(stateFile, "unreadable JSON", preserveCorrupt);
        }
        try {
            String version = StateMigrator.detectVersion(tree.get());
            QueueState state = migrator.migrate(tree.get());
            if (preserveCorrupt && !QueueState.CURRENT_VERSION.equals(version)) {
                log.info("Migrating queue state {} from version {} to {}", stateFile, version, QueueState.CURRENT_VERSION);
            }
            return state;
        } catch (QueueStateException e) {
            return recoverCorrupt(stateFile, e.getMessage(), preserveCorrupt);
        }
    }

    private QueueState recoverCorrupt(Path stateFile, String reason, boolean preserve) {
        if (!preserve) {
            log.warn("Queue state {} is corrupt ({}); reporting an empty queue", stateFile, reason);
            return QueueState.empty();
        }
        Path backup = stateFile.resolveSibling(stateFile.getFileName() + ".corrupt-" + clock.millis());
        try {
            Files.copy(stateFile, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Queue state {} is corrupt ({}); starting fresh, previous content kept in {}", stateFile, reason, backup);
        } catch (IOException e) {
            log.warn("Queue state {} is corrupt ({}); starting fresh, backup failed: {}", stateFile, reason, e.getMessage());
        }
        return QueueState.empty();
    }

    private void persist(QueueState state, Instant now) {
        state.touch(now);
        try {
            store.write(paths.stateFile(), state);
        } catch (IOException e) {
            throw new QueueStateException("Failed to persist queue state: " + paths.stateFile(), e);
        }
    }

    private SourceDefinition requireSource(String sourceId) {
        SourceDefinition source = sources.get(sourceId);
        if (source == null) {
            throw new IllegalArgumentException("Unknown source: " + sourceId);
        }
        return source;
    }

    private RunningMarker marker(String sourceId, String taskId) {
        return new RunningMarker(
                sources.get(sourceId).layout().pending(),
                taskId,
                store,
                liveness,
                self,
                settings.lockPollInterval()
        );
    }

    private static void releaseQuietly(Claim claim) {
        try {
            claim.marker().release();
        } catch (IllegalStateException e) {
            log.warn("[{}] [{}] could not clear running marker: {}", claim.sourceId(), claim.taskId(), e.getMessage());
        }
    }

    private static boolean inScope(Set<String> scope, String sourceId) {
        return scope.isEmpty() || scope.contains(sourceId);
    }

    private int pendingCount(QueueState state, Set<String> scope) {
        int pending = 0;
        for (SourceState source : state.sources().values()) {
            if (inScope(scope, source.id()) && sources.containsKey(source.id())) {
                pending += source.count(TaskStatus.PENDING);
            }
        }
        return pending;
    }

    private static String key(String sourceId, String taskId) {
        return sourceId + "/" + taskId;
    }

    private record Claim(
            String sourceId,
            String taskId,
            Path specPath,
            int attempt,
            Instant startedAt,
            SourceLayout layout,
            RunningMarker marker
    ) {
        String key() {
            return TaskProcessor.key(sourceId, taskId);
        }
    }

    public enum ProcessStatus {
        SKIPPED,
        EMPTY,
        COMPLETED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    // maxTasks <= 0 means no limit; an empty scope means every source.
    public record ProcessRequest(int maxTasks, Set<String> scope) {
        public ProcessRequest {
            scope = scope == null ? Set.of() : Set.copyOf(scope);
        }

        public static ProcessRequest all(int maxTasks) {
            return new ProcessRequest(maxTasks, Set.of());
        }

        public static ProcessRequest forSource(String sourceId, int maxTasks) {
            return new ProcessRequest(maxTasks, Set.of(sourceId));
        }
    }

    public record ProcessOutcome(
            ProcessStatus status,
            int processed,
            int failed,
            int cancelled,
            int remaining,
            List<DispatchedTask> dispatched,
            List<String> warnings
    ) {
        public ProcessOutcome {
            dispatched = List.copyOf(dispatched);
            warnings = List.copyOf(warnings);
        }

        static ProcessOutcome skipped() {
            return new ProcessOutcome(ProcessStatus.SKIPPED, 0, 0, 0, 0, List.of(), List.of());
        }

        static ProcessOutcome empty() {
            return new ProcessOutcome(ProcessStatus.EMPTY, 0, 0, 0, 0, List.of(), List.of());
        }
    }

    public record DispatchedTask(String sourceId, String taskId, TaskStatus status, String error, double durationSeconds) {
    }

    public record LoadOutcome(int added, int requeued, int unchanged, Map<String, Integer> bySource) {
        public LoadOutcome {
            bySource = Collections.unmodifiableMap(new LinkedHashMap<>(bySource));
        }
    }
}
