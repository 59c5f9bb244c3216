package com.resonance.matrix.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.HeartbeatRecord;
import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.MigrationCheckpoint;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.ErrorEvent;
import com.resonance.matrix.error.ErrorSink;
import com.resonance.matrix.error.MatrixException;
import com.resonance.matrix.error.ResourceLimitExceededException;
import com.resonance.matrix.error.ValidationException;
import com.resonance.matrix.governor.ResourceGovernor;
import com.resonance.matrix.governor.ResourceReading;
import com.resonance.matrix.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A single, cooperative migration run. Each call to {@link #next()} processes one batch
 * and returns its progress; the caller decides when to ask for the next one.
 *
 * <p>Cancellation and the resource governor are checked in {@link #hasNext()}, before a
 * batch starts. The governor is also sampled at every heartbeat, so a hard kill stops
 * the run within one heartbeat interval. On abort the unflushed buffer is discarded
 * and the last persisted checkpoint is kept, with only its abort reason updated.</p>
 *
 * <p>Checkpoint boundaries are absolute input indices, so a resumed run writes exactly
 * the output parts an uninterrupted run would have written.</p>
 *
 * <p>Not thread-safe, except for {@link #cancel()}.</p>
 */
public class MigrationRun implements Iterator<BatchProgress>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MigrationRun.class);

    private final MigrationConfig config;
    private final MigrationOptions options;
    private final ResourceGovernor governor;
    private final MetricsService metrics;
    private final ErrorSink errorSink;
    private final CheckpointStore store;
    private final HeartbeatLog heartbeatLog;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final NodeValidator validator = new NodeValidator();
    private final GoldStandardAnchors anchors;
    private final NodeTransformer transformer;
    private final List<MigratedNode> buffer = new ArrayList<>();

    private volatile boolean cancelled;

    private MigrationState state = MigrationState.IDLE;
    private StreamingNodeReader reader;
    private MigrationCheckpoint checkpoint = MigrationCheckpoint.initial();
    private MigrationResult result;
    private String abortReason;
    private String lastNodeId;
    private boolean boundaryChecked;

    private long inputSize;
    private long index;
    private long endIndex;
    private long processed;
    private long migrated;
    private long skipped;
    private long baseMigrated;
    private long baseSkipped;
    private int checkpointsWritten;
    private int batchNumber;
    private long startNanos;
    private long startMemoryMb;

    MigrationRun(MigrationConfig config, MigrationOptions options, ResourceGovernor governor,
                 MetricsService metrics, ErrorSink errorSink, CheckpointStore store,
                 HeartbeatLog heartbeatLog, ObjectMapper mapper, Clock clock) {
        this.config = config;
        this.options = options;
        this.governor = governor;
        this.metrics = metrics;
        this.errorSink = errorSink;
        this.store = store;
        this.heartbeatLog = heartbeatLog;
        this.mapper = mapper;
        this.clock = clock;
        this.anchors = new GoldStandardAnchors(config.anchors());
        this.transformer = new NodeTransformer(anchors);
    }

    /**
     * Counts the input, restores the checkpoint and positions the reader at the resume index.
     */
    void open(Path input) {
        state = state.transitionTo(MigrationState.LOADING);
        startNanos = System.nanoTime();
        try {
            startMemoryMb = governor.assess().memory().usedMb();
            inputSize = StreamingNodeReader.count(input, mapper);
            if (!options.dryRun()) {
                if (options.fresh()) {
                    store.reset();
                }
                checkpoint = store.load().orElse(MigrationCheckpoint.initial());
            }
            if (checkpoint.lastProcessedIndex() > inputSize) {
                throw new CorruptionDetectedException("Checkpoint index " + checkpoint.lastProcessedIndex()
                        + " is beyond the input size " + inputSize);
            }
            baseMigrated = checkpoint.migratedCount();
            baseSkipped = checkpoint.skippedCount();
            lastNodeId = checkpoint.lastSuccessfulNodeId();

            if (checkpoint.completed()) {
                log.info("migration.already_completed index={} parts={}",
                        checkpoint.lastProcessedIndex(), checkpoint.checkpointCount());
                state = state.transitionTo(MigrationState.COMPLETED);
                result = buildResult();
                return;
            }

            index = checkpoint.lastProcessedIndex();
            endIndex = options.hasLimit() ? Math.min(inputSize, index + options.limit()) : inputSize;
            reader = new StreamingNodeReader(input, mapper);
            reader.skip(index);
            if (index > 0) {
                log.info("migration.resumed index={} inputSize={} parts={}",
                        index, inputSize, checkpoint.checkpointCount());
            }
            state = state.transitionTo(MigrationState.PROCESSING);
        } catch (MatrixException e) {
            state = MigrationState.ABORTED;
            abortReason = e.getMessage();
            closeReader();
            throw e;
        }
        if (index >= endIndex) {
            finish();
        }
    }

    @Override
    public boolean hasNext() {
        if (state != MigrationState.PROCESSING) {
            return false;
        }
        if (!boundaryChecked) {
            boundaryChecked = true;
            if (cancelled) {
                abort("cancelled");
                return false;
            }
            try {
                governor.enforce();
            } catch (ResourceLimitExceededException e) {
                abort(e.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Processes the next batch.
     *
     * @throws CorruptionDetectedException when the input stream turns out to be malformed;
     *                                     the run is aborted and the last checkpoint kept as is
     */
    @Override
    public BatchProgress next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        boundaryChecked = false;
        batchNumber++;
        long batchStart = System.nanoTime();
        int consumed = 0;
        try {
            while (consumed < config.batchSize() && index < endIndex) {
                if (!reader.hasNext()) {
                    throw new CorruptionDetectedException("Input ended at index " + index
                            + " but " + inputSize + " nodes were counted");
                }
                long position = index++;
                consumed++;
                processed++;
                migrateNext(position);

                if (index % config.checkpointInterval() == 0 && index < endIndex) {
                    checkpoint();
                }
                if (index % config.heartbeatInterval() == 0) {
                    heartbeat();
                }
            }
        } catch (ResourceLimitExceededException e) {
            abort(e.getMessage());
        } catch (CorruptionDetectedException e) {
            fail(e);
            throw e;
        }

        Duration batchDuration = Duration.ofNanos(System.nanoTime() - batchStart);
        metrics.recordBatch(consumed, batchDuration);
        if (state == MigrationState.PROCESSING && index >= endIndex) {
            finish();
        }
        log.debug("migration.batch number={} nodes={} index={} durationMs={}",
                batchNumber, consumed, index, batchDuration.toMillis());
        return new BatchProgress(batchNumber, consumed, index, inputSize,
                baseMigrated + migrated, baseSkipped + skipped, batchDuration, state);
    }

    /**
     * Requests cancellation. Observed before the next batch starts.
     */
    public void cancel() {
        cancelled = true;
    }

    public MigrationState getState() {
        return state;
    }

    public long getInputSize() {
        return inputSize;
    }

    /**
     * Returns the final summary.
     *
     * @throws IllegalStateException if the run has not reached a terminal state
     */
    public MigrationResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Migration run not finished, state=" + state);
        }
        return result;
    }

    @Override
    public void close() {
        closeReader();
        if (heartbeatLog != null) {
            heartbeatLog.close();
        }
    }

    private void migrateNext(long position) {
        try {
            Node node = reader.next();
            validator.validate(node, position);
            MigratedNode migratedNode = transformer.transform(node);
            buffer.add(migratedNode);
            if (migratedNode.goldStandard()) {
                anchors.pin(migratedNode);
            }
            migrated++;
            lastNodeId = migratedNode.id();
        } catch (ValidationException e) {
            skipped++;
            metrics.incrementNodesSkipped();
            log.warn("migration.node.skipped index={} nodeId={} reason={}",
                    position, e.getNodeId(), e.getMessage());
            appendLog(HeartbeatRecord.event("skip", position, lastNodeId,
                    "nodeId=" + e.getNodeId() + " " + e.getMessage()));
            errorSink.report(ErrorEvent.of("validation", e.getNodeId(),
                    "index " + position + ": " + e.getMessage()));
        }
    }

    private void heartbeat() {
        ResourceReading reading = governor.enforce();
        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        double nodesPerSecond = elapsedSeconds > 0 ? processed / elapsedSeconds : 0.0;
        long memoryMb = reading.memory().usedMb();
        appendLog(HeartbeatRecord.heartbeat(index, round2(elapsedSeconds), round2(nodesPerSecond),
                memoryMb, memoryMb - startMemoryMb, lastNodeId));
        log.info("migration.heartbeat index={} inputSize={} nodesPerSecond={} heapMB={}",
                index, inputSize, Math.round(nodesPerSecond), memoryMb);
    }

    private void checkpoint() {
        state = state.transitionTo(MigrationState.CHECKPOINTING);
        persist(false);
        checkpointsWritten++;
        metrics.incrementCheckpoints();
        appendLog(HeartbeatRecord.event("checkpoint", index, lastNodeId,
                "part " + checkpoint.checkpointCount()));
        log.info("migration.checkpoint index={} parts={} migrated={} skipped={}",
                index, checkpoint.checkpointCount(), checkpoint.migratedCount(), checkpoint.skippedCount());
        state = state.transitionTo(MigrationState.PROCESSING);
    }

    private void finish() {
        boolean reachedEnd = index >= inputSize;
        state = state.transitionTo(MigrationState.CHECKPOINTING);
        persist(reachedEnd);
        state = state.transitionTo(MigrationState.COMPLETED);
        closeReader();
        result = buildResult();
        if (reachedEnd) {
            log.info("migration.completed processed={}/{} migrated={} skipped={} parts={}",
                    index, inputSize, checkpoint.migratedCount(), checkpoint.skippedCount(),
                    checkpoint.checkpointCount());
        } else {
            log.info("migration.limit_reached processed={}/{} limit={} parts={}",
                    index, inputSize, options.limit(), checkpoint.checkpointCount());
        }
    }

    /**
     * Writes the buffered output as the next part, then the checkpoint covering it.
     */
    private void persist(boolean completed) {
        int parts = checkpoint.checkpointCount();
        if (!buffer.isEmpty()) {
            parts++;
            if (!options.dryRun()) {
                store.writePart(parts, buffer);
            }
        }
        checkpoint = new MigrationCheckpoint(index, index, baseMigrated + migrated, baseSkipped + skipped,
                clock.instant(), lastNodeId, parts, completed, null);
        if (!options.dryRun()) {
            store.save(checkpoint);
        }
        buffer.clear();
    }

    private void abort(String reason) {
        state = state.transitionTo(MigrationState.ABORTED);
        abortReason = reason;
        buffer.clear();
        checkpoint = checkpoint.withAbortReason(reason);
        if (!options.dryRun()) {
            store.save(checkpoint);
        }
        appendLog(HeartbeatRecord.event("abort", index, lastNodeId, reason));
        errorSink.report(ErrorEvent.of("abort", lastNodeId, reason));
        log.warn("migration.aborted reason={} index={} checkpointIndex={}",
                reason, index, checkpoint.lastProcessedIndex());
        closeReader();
        result = buildResult();
    }

    private void fail(CorruptionDetectedException e) {
        state = state.transitionTo(MigrationState.ABORTED);
        abortReason = e.getMessage();
        buffer.clear();
        appendLog(HeartbeatRecord.event("abort", index, lastNodeId, e.getMessage()));
        errorSink.report(ErrorEvent.of("corruption", lastNodeId, e.getMessage()));
        log.error("migration.corruption index={} checkpointIndex={} error={}",
                index, checkpoint.lastProcessedIndex(), e.getMessage());
        closeReader();
        result = buildResult();
    }

    private void appendLog(HeartbeatRecord record) {
        if (heartbeatLog != null) {
            heartbeatLog.append(record);
        }
    }

    private void closeReader() {
        if (reader != null) {
            reader.close();
            reader = null;
        }
    }

    private MigrationResult buildResult() {
        return new MigrationResult(state, inputSize, processed, migrated, skipped, checkpointsWritten,
                checkpoint, abortReason, new ArrayList<>(anchors.pinned().values()),
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
