/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.textarchive.recovery;

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.archive.ArchiveEvent;
import dev.mars.textarchive.archive.ArchiveReader;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.ParsedArchive;
import dev.mars.textarchive.archive.ParsedEvent;
import dev.mars.textarchive.archive.UnparsedLine;
import dev.mars.textarchive.consistency.ConsistencyValidator;
import dev.mars.textarchive.consistency.DivergenceReport;
import dev.mars.textarchive.store.CanonicalRecord;
import dev.mars.textarchive.store.CanonicalStore;
import dev.mars.textarchive.store.ConstraintViolationException;
import dev.mars.textarchive.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rebuilds the store from the archive.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Entity types are visited stage by stage ({@link RecoveryPlan}); with
 *       {@code parallelism > 1} the types of one stage run concurrently.</li>
 *   <li>Partitions of a type are replayed in relative-path order, which is date order.
 *       With no role definitions archived, the default roles are created instead.</li>
 *   <li>Every parsed event is upserted by natural key, so replaying twice never creates
 *       duplicates.</li>
 *   <li>After each partition the checkpoint is saved. A failed or cancelled run leaves
 *       it behind and the next run skips the partitions it lists.</li>
 *   <li>When every partition is done the checkpoint is deleted and every type is
 *       validated with {@link ConsistencyValidator}.</li>
 * </ol>
 * <p>
 * <b>Error handling:</b> unparseable lines are logged, reported and skipped. A write
 * rejected by a constraint gets placeholder users for its missing actor and one retry;
 * a second rejection fails the run with {@link RecoveryException}.
 * <p>
 * Cancellation is cooperative and takes effect at the next partition boundary.
 */
public final class RecoveryOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    private final ArchiveConfig config;
    private final ArchiveReader reader;
    private final CanonicalStore store;
    private final ConsistencyValidator validator;
    private final CheckpointStore checkpoints;
    private final ExecutorService executor;
    private final Clock clock;

    private final AtomicReference<RecoveryState> state = new AtomicReference<>(RecoveryState.NOT_STARTED);
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean cancelRequested;

    public RecoveryOrchestrator(ArchiveConfig config, ArchiveReader reader, CanonicalStore store,
                                ConsistencyValidator validator) {
        this(config, reader, store, validator, Clock.systemDefaultZone());
    }

    public RecoveryOrchestrator(ArchiveConfig config, ArchiveReader reader, CanonicalStore store,
                                ConsistencyValidator validator, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.reader = reader;
        this.store = store;
        this.validator = validator;
        this.checkpoints = new CheckpointStore(config.checkpointFile(), config.syncEnabled());

        // Async runs are serialized on one thread
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "archive-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    public RecoveryState state() {
        return state.get();
    }

    public CheckpointStore checkpoints() {
        return checkpoints;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public RecoveryReport recoverAll() {
        return recoverAll(RecoveryOptions.defaults(config));
    }

    /**
     * Runs recovery on the calling thread.
     *
     * @throws RecoveryException     if a partition cannot be replayed; the state is then
     *                               {@code FAILED} and the checkpoint names the partition
     * @throws IllegalStateException if another run is in progress
     */
    public RecoveryReport recoverAll(RecoveryOptions options) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Recovery is already running");
        }
        cancelRequested = false;
        try {
            return run(options);
        } finally {
            running.set(false);
        }
    }

    public CompletableFuture<RecoveryReport> recoverAllAsync() {
        return recoverAllAsync(RecoveryOptions.defaults(config));
    }

    /** Runs recovery on the orchestrator's own thread. */
    public CompletableFuture<RecoveryReport> recoverAllAsync(RecoveryOptions options) {
        return CompletableFuture.supplyAsync(() -> recoverAll(options), executor);
    }

    /** Requests the running recovery to stop after its current partition. */
    public void cancel() {
        cancelRequested = true;
        LOG.info("Recovery cancellation requested");
    }

    @Override
    public void close() {
        cancel();
        executor.shutdown();
    }

    // ========================================================================
    // Run
    // ========================================================================

    /** State of one run, shared by its workers. */
    private final class Run {
        final RecoveryOptions options;
        final Set<String> completed = ConcurrentHashMap.newKeySet();
        final RecoveryStats stats = new RecoveryStats();
        final AtomicReference<String> failedPartition = new AtomicReference<>();

        Run(RecoveryOptions options, RecoveryCheckpoint resume) {
            this.options = options;
            completed.addAll(resume.completed());
        }

        boolean stopRequested() {
            return cancelRequested || failedPartition.get() != null;
        }

        void saveCheckpoint() {
            if (!options.dryRun()) {
                checkpoints.save(new RecoveryCheckpoint(completed, failedPartition.get()));
            }
        }
    }

    private RecoveryReport run(RecoveryOptions options) {
        long start = System.nanoTime();
        RecoveryCheckpoint resume = options.dryRun()
                ? RecoveryCheckpoint.empty()
                : checkpoints.load().orElse(RecoveryCheckpoint.empty());
        if (resume.failedPartition() != null) {
            LOG.info("Resuming recovery at previously failed partition {}", resume.failedPartition());
        }
        Run run = new Run(options, resume);

        LOG.info("Starting recovery from {} (updateExisting={}, dryRun={}, parallelism={})",
                reader.layout().root(), options.updateExisting(), options.dryRun(), options.parallelism());
        state.set(RecoveryState.running(null, null));

        for (List<EntityType> stage : RecoveryPlan.stages()) {
            if (!runStage(stage, run)) {
                state.set(state.get().withPhase(RecoveryState.Phase.CANCELLED));
                LOG.warn("Recovery cancelled with {} partitions done; checkpoint kept at {}",
                        run.completed.size(), checkpoints.file());
                return report(run, Map.of(), true, start);
            }
        }

        Map<EntityType, DivergenceReport> divergence = Map.of();
        if (!options.dryRun()) {
            checkpoints.delete();
            divergence = validator.validateAll();
        }
        state.set(state.get().withPhase(RecoveryState.Phase.COMPLETED));

        RecoveryReport report = report(run, divergence, false, start);
        LOG.info("Recovery {}: {} events parsed, {} rows inserted, {} lines unparsed, {} partitions skipped, {} ms",
                options.dryRun() ? "dry run finished" : "completed",
                report.totalParsed(), report.totalInserted(), report.unparsed().size(),
                report.skippedPartitions(), report.elapsed().toMillis());
        if (!options.dryRun() && !report.isConsistent()) {
            LOG.warn("Store diverges from archive after recovery; see the divergence reports");
        }
        return report;
    }

    /** @return false if the run was cancelled */
    private boolean runStage(List<EntityType> stage, Run run) {
        if (run.options.parallelism() == 1 || stage.size() == 1) {
            for (EntityType type : stage) {
                if (!recoverType(type, run)) {
                    return false;
                }
            }
            return true;
        }

        int threads = Math.min(run.options.parallelism(), stage.size());
        LOG.debug("Recovering {} with {} workers", stage, threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads());
        try {
            List<Future<Boolean>> futures = new ArrayList<>(stage.size());
            for (EntityType type : stage) {
                futures.add(pool.submit(() -> recoverType(type, run)));
            }
            boolean all = true;
            RuntimeException failure = null;
            for (Future<Boolean> f : futures) {
                try {
                    all &= f.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    RuntimeException wrapped = cause instanceof RuntimeException re
                            ? re : new RecoveryException("Recovery worker failed", cause);
                    if (failure == null) {
                        failure = wrapped;
                    } else {
                        failure.addSuppressed(wrapped);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelRequested = true;
                    throw new RecoveryException("Interrupted while waiting for recovery workers", e);
                }
            }
            if (failure != null) {
                throw failure;
            }
            return all;
        } finally {
            pool.shutdown();
        }
    }

    /** @return false if stopped before the last partition */
    private boolean recoverType(EntityType type, Run run) {
        List<Path> partitions = reader.partitions(type);
        LOG.debug("{}: {} partitions", type, partitions.size());
        if (type == EntityType.ROLE && partitions.isEmpty()) {
            seedDefaultRoles(run);
        }
        for (Path partition : partitions) {
            if (run.stopRequested()) {
                return false;
            }
            String rel = reader.layout().relativize(partition);
            if (run.completed.contains(rel)) {
                run.stats.skippedPartition();
                LOG.debug("Skipping {} (done in a previous run)", rel);
                continue;
            }
            state.set(RecoveryState.running(type, rel));
            try {
                replay(type, partition, rel, run);
            } catch (RuntimeException e) {
                run.failedPartition.compareAndSet(null, rel);
                state.set(RecoveryState.failed(type, rel, e));
                run.saveCheckpoint();
                LOG.error("Recovery failed at {} ({}): {}", rel, type, e.getMessage(), e);
                throw e instanceof RecoveryException re
                        ? re : new RecoveryException("Recovery failed at " + rel + ": " + e.getMessage(), e);
            }
            run.completed.add(rel);
            run.stats.partition(type);
            run.saveCheckpoint();
        }
        return true;
    }

    private void replay(EntityType type, Path partition, String rel, Run run) {
        LOG.debug("Replaying {}", rel);
        try (ParsedArchive.Cursor events = reader.parse(type, partition).open()) {
            while (events.hasNext()) {
                ArchiveEvent event = events.next();
                if (event instanceof UnparsedLine line) {
                    LOG.warn("Skipping {}:{} ({}): {}", rel, line.lineNumber(), line.reason(), line.text());
                    run.stats.unparsed(type, rel, line);
                    continue;
                }
                ParsedEvent parsed = (ParsedEvent) event;
                run.stats.parsed(parsed.type());
                if (run.options.dryRun()) {
                    continue;
                }
                CanonicalRecord record = parsed.toRecord(rel);
                UpsertResult result = upsert(record, run);
                run.stats.upserted(record.type(), result);
                LOG.trace("{} {}", result, record.naturalKey());
            }
        }
    }

    /** Without any archived role definitions the store still gets the built-in roles. */
    private void seedDefaultRoles(Run run) {
        LOG.warn("No role definitions archived; {} default roles",
                run.options.dryRun() ? "would create" : "creating");
        if (run.options.dryRun()) {
            return;
        }
        for (CanonicalRecord role : CanonicalRecord.defaultRoles(LocalDateTime.now(clock))) {
            run.stats.upserted(EntityType.ROLE, store.upsert(role, false));
        }
    }

    private UpsertResult upsert(CanonicalRecord record, Run run) {
        try {
            return store.upsert(record, run.options.updateExisting());
        } catch (ConstraintViolationException first) {
            LOG.debug("Constraint violation for {}, retrying after placeholders: {}",
                    record.naturalKey(), first.getMessage());
            createPlaceholders(record, run);
            try {
                return store.upsert(record, run.options.updateExisting());
            } catch (ConstraintViolationException second) {
                second.addSuppressed(first);
                throw new RecoveryException("Cannot store " + record.naturalKey() + " from "
                        + record.archivePath() + ": " + second.getMessage(), second);
            }
        }
    }

    private void createPlaceholders(CanonicalRecord record, Run run) {
        if (!record.type().actorReferencesUser()) {
            return;
        }
        CanonicalRecord placeholder = CanonicalRecord.placeholderUser(record.actor(), record.occurredAt());
        if (store.find(placeholder.naturalKey()).isPresent()) {
            return;
        }
        try {
            store.upsert(placeholder, false);
            run.stats.placeholder(record.type());
            LOG.info("Created placeholder user '{}' referenced from {}", record.actor(), record.archivePath());
        } catch (ConstraintViolationException e) {
            LOG.debug("Placeholder user '{}' created concurrently: {}", record.actor(), e.getMessage());
        }
    }

    private RecoveryReport report(Run run, Map<EntityType, DivergenceReport> divergence, boolean cancelled, long start) {
        return new RecoveryReport(run.stats.counts(), run.stats.unparsed(), divergence,
                run.stats.skippedPartitions(), run.options.dryRun(), cancelled,
                Duration.ofNanos(System.nanoTime() - start));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "archive-recovery-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
