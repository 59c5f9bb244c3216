package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One line of the append-only migration log.
 *
 * @param timestamp      when the record was written
 * @param event          {@code heartbeat}, {@code skip}, {@code checkpoint} or {@code abort}
 * @param nodeIndex      number of input indices consumed so far
 * @param elapsedSeconds wall time since the run started
 * @param nodesPerSecond throughput of this run
 * @param memoryMb       heap in use
 * @param memoryDeltaMb  heap growth since the run started
 * @param lastNodeId     last successfully transformed node
 * @param message        skip or abort reason, null for heartbeats
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeartbeatRecord(
        Instant timestamp,
        String event,
        long nodeIndex,
        Double elapsedSeconds,
        Double nodesPerSecond,
        Long memoryMb,
        Long memoryDeltaMb,
        String lastNodeId,
        String message
) {

    public static HeartbeatRecord heartbeat(long nodeIndex, double elapsedSeconds, double nodesPerSecond,
                                            long memoryMb, long memoryDeltaMb, String lastNodeId) {
        return new HeartbeatRecord(Instant.now(), "heartbeat", nodeIndex, elapsedSeconds, nodesPerSecond,
                memoryMb, memoryDeltaMb, lastNodeId, null);
    }

    public static HeartbeatRecord event(String event, long nodeIndex, String lastNodeId, String message) {
        return new HeartbeatRecord(Instant.now(), event, nodeIndex, null, null, null, null, lastNodeId, message);
    }
}
